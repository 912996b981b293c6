package com.example.pokebattle.persistence;

import com.example.pokebattle.error.DataIntegrityException;
import com.example.pokebattle.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Seeds the reference database from YAML resources on the classpath.
 * - /data/moves.yaml: move definitions, loaded first
 * - /data/pokemon.yaml: Pokemon with stats, types, abilities and learnsets
 *
 * Rows are written with MERGE, so loading twice leaves the same data.
 */
public class DataLoader {

    private static final Logger logger = LoggerFactory.getLogger(DataLoader.class);

    public static final String MOVES_RESOURCE = "/data/moves.yaml";
    public static final String POKEMON_RESOURCE = "/data/pokemon.yaml";

    private DataLoader() { }

    public static void loadDefaults(PokemonDAO dao) {
        int moves = loadMovesFromYamlResource(dao, MOVES_RESOURCE);
        int pokemon = loadPokemonFromYamlResource(dao, POKEMON_RESOURCE);
        logger.info("[DataLoader] Loaded {} moves and {} pokemon", moves, pokemon);
    }

    @SuppressWarnings("unchecked")
    public static int loadMovesFromYamlResource(PokemonDAO dao, String resourcePath) {
        Map<String, Object> root = readYaml(resourcePath);
        if (root == null) return 0;
        List<Map<String, Object>> moveList = (List<Map<String, Object>>) root.get("moves");
        if (moveList == null) return 0;

        int count = 0;
        for (Map<String, Object> data : moveList) {
            dao.saveMove(parseMove(data));
            count++;
        }
        logger.debug("[DataLoader] {} moves from {}", count, resourcePath);
        return count;
    }

    @SuppressWarnings("unchecked")
    public static int loadPokemonFromYamlResource(PokemonDAO dao, String resourcePath) {
        Map<String, Object> root = readYaml(resourcePath);
        if (root == null) return 0;
        List<Map<String, Object>> pokemonList = (List<Map<String, Object>>) root.get("pokemon");
        if (pokemonList == null) return 0;

        int count = 0;
        for (Map<String, Object> data : pokemonList) {
            String name = getString(data, "name", "");
            if (name.isBlank()) {
                throw new DataIntegrityException("Pokemon entry without a name in " + resourcePath);
            }

            Map<Stat, Integer> stats = new EnumMap<>(Stat.class);
            Object statsObj = data.get("stats");
            if (statsObj instanceof Map) {
                for (Map.Entry<?, ?> e : ((Map<?, ?>) statsObj).entrySet()) {
                    Stat stat = Stat.fromKey(String.valueOf(e.getKey()));
                    if (stat == null) {
                        throw new DataIntegrityException("Unknown stat '" + e.getKey() + "' for " + name);
                    }
                    stats.put(stat, toInt(e.getValue(), name + " " + stat.getKey()));
                }
            }

            List<PokemonType> types = new ArrayList<>();
            Object typesObj = data.get("types");
            if (typesObj instanceof List) {
                for (Object t : (List<?>) typesObj) {
                    types.add(PokemonType.fromString(String.valueOf(t)));
                }
            }

            List<ProfileDocument.Ability> abilities = new ArrayList<>();
            Object abilitiesObj = data.get("abilities");
            if (abilitiesObj instanceof List) {
                int slot = 1;
                for (Object o : (List<?>) abilitiesObj) {
                    Map<String, Object> a = requireMap(o, "ability", name);
                    abilities.add(new ProfileDocument.Ability(
                        getString(a, "name", ""),
                        getInt(a, "slot", slot),
                        Boolean.TRUE.equals(a.get("hidden")),
                        getString(a, "short_effect", "")));
                    slot++;
                }
            }

            Map<String, Integer> learnset = new LinkedHashMap<>();
            Object movesObj = data.get("moves");
            if (movesObj instanceof List) {
                for (Object o : (List<?>) movesObj) {
                    Map<String, Object> m = requireMap(o, "learnset entry", name);
                    String moveName = getString(m, "name", "");
                    if (dao.lookupMove(moveName).isEmpty()) {
                        throw new DataIntegrityException("Unknown move '" + moveName + "' in learnset of " + name);
                    }
                    learnset.put(moveName, getInt(m, "level", 1));
                }
            }

            dao.savePokemon(name, getInteger(data, "species_id"), getInteger(data, "evolves_from_species_id"),
                getInteger(data, "evolution_chain_id"), stats, types, abilities, learnset);
            count++;
        }
        logger.debug("[DataLoader] {} pokemon from {}", count, resourcePath);
        return count;
    }

    private static Move parseMove(Map<String, Object> data) {
        String name = getString(data, "name", "");
        if (name.isBlank()) {
            throw new DataIntegrityException("Move entry without a name");
        }
        PokemonType type = PokemonType.fromString(getString(data, "type", null));
        MoveCategory category = MoveCategory.fromString(getString(data, "damage_class", null));
        int power = getInt(data, "power", 0);
        // a missing accuracy means the move never misses
        int accuracy = getInt(data, "accuracy", 100);

        SecondaryEffect effect = null;
        String status = getString(data, "status_effect", null);
        if (status != null && !status.isBlank()) {
            int chance = getInt(data, "effect_chance", 0);
            try {
                effect = new SecondaryEffect(StatusType.fromString(status), chance);
            } catch (IllegalArgumentException e) {
                throw new DataIntegrityException("Bad secondary effect on " + name + ": " + e.getMessage(), e);
            }
        }
        return new Move(name, type, category, power, accuracy, effect, getString(data, "short_effect", ""));
    }

    private static Map<String, Object> readYaml(String resourcePath) {
        try (InputStream in = DataLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("[DataLoader] Resource not found: {}", resourcePath);
                return null;
            }
            Yaml yaml = new Yaml();
            return yaml.load(in);
        } catch (IOException e) {
            throw new DataIntegrityException("Failed to read " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireMap(Object entry, String what, String pokemon) {
        if (!(entry instanceof Map)) {
            throw new DataIntegrityException("Malformed " + what + " for " + pokemon + ": " + entry);
        }
        return (Map<String, Object>) entry;
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? String.valueOf(val) : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Integer v = getInteger(map, key);
        return v != null ? v : defaultVal;
    }

    private static Integer getInteger(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val == null) return null;
        return toInt(val, key);
    }

    private static int toInt(Object val, String what) {
        if (val instanceof Number) return ((Number) val).intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            throw new DataIntegrityException("Not a number for " + what + ": " + val, e);
        }
    }
}
