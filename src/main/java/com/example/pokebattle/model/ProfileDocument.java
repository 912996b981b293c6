package com.example.pokebattle.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Informational profile returned by the info query: stats, types, abilities,
 * level-up moves and evolution data. Carries no battle logic.
 */
public class ProfileDocument {

    public record Ability(String name, int slot, boolean hidden, String shortEffect) { }

    public record SpeciesEntry(int id, String name, Integer evolvesFromSpeciesId) { }

    private final String name;
    private final Map<Stat, Integer> baseStats;
    private final List<PokemonType> types;
    private final List<Ability> abilities;
    private final List<Move> moves;
    private final Integer speciesId;
    private final Integer evolvesFromSpeciesId;
    private final Integer evolutionChainId;
    private final List<SpeciesEntry> evolutionChain;

    public ProfileDocument(String name, Map<Stat, Integer> baseStats, List<PokemonType> types,
                           List<Ability> abilities, List<Move> moves, Integer speciesId,
                           Integer evolvesFromSpeciesId, Integer evolutionChainId,
                           List<SpeciesEntry> evolutionChain) {
        this.name = name;
        EnumMap<Stat, Integer> stats = new EnumMap<>(Stat.class);
        if (baseStats != null) stats.putAll(baseStats);
        this.baseStats = stats;
        this.types = types == null ? List.of() : List.copyOf(types);
        this.abilities = abilities == null ? List.of() : List.copyOf(abilities);
        this.moves = moves == null ? List.of() : List.copyOf(moves);
        this.speciesId = speciesId;
        this.evolvesFromSpeciesId = evolvesFromSpeciesId;
        this.evolutionChainId = evolutionChainId;
        this.evolutionChain = evolutionChain == null ? List.of() : List.copyOf(evolutionChain);
    }

    public String getName() { return name; }
    public Map<Stat, Integer> getBaseStats() { return baseStats; }
    public List<PokemonType> getTypes() { return types; }
    public List<Ability> getAbilities() { return abilities; }
    public List<Move> getMoves() { return moves; }
    public Integer getSpeciesId() { return speciesId; }
    public Integer getEvolvesFromSpeciesId() { return evolvesFromSpeciesId; }
    public Integer getEvolutionChainId() { return evolutionChainId; }
    public List<SpeciesEntry> getEvolutionChain() { return evolutionChain; }

    /**
     * Structured form for the tool surface. Row ids of the species and chain are left
     * out except the evolves-from links and the chain member ids, which callers need
     * to rebuild the evolution tree.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);

        List<Map<String, Object>> stats = new ArrayList<>();
        for (Stat s : Stat.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("stat", s.getKey());
            row.put("base_stat", baseStats.getOrDefault(s, 0));
            stats.add(row);
        }
        out.put("stats", stats);

        List<String> typeKeys = new ArrayList<>();
        for (PokemonType t : types) typeKeys.add(t.getKey());
        out.put("types", typeKeys);

        List<Map<String, Object>> abilityRows = new ArrayList<>();
        for (Ability a : abilities) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", a.name());
            row.put("slot", a.slot());
            row.put("is_hidden", a.hidden());
            if (a.shortEffect() != null && !a.shortEffect().isEmpty()) {
                row.put("short_effect", a.shortEffect());
            }
            abilityRows.add(row);
        }
        out.put("abilities", abilityRows);

        List<Map<String, Object>> moveRows = new ArrayList<>();
        for (Move m : moves) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", m.getName());
            row.put("type", m.getType().getKey());
            row.put("damage_class", m.getCategory().getKey());
            row.put("power", m.getPower());
            row.put("accuracy", m.getAccuracy());
            row.put("effect_chance", m.hasSecondaryEffect() ? m.getSecondaryEffect().chancePercent() : null);
            if (!m.getShortEffect().isEmpty()) {
                row.put("short_effect", m.getShortEffect());
            }
            moveRows.add(row);
        }
        out.put("moves", moveRows);

        Map<String, Object> species = new LinkedHashMap<>();
        species.put("name", name);
        species.put("evolves_from_species_id", evolvesFromSpeciesId);
        List<Map<String, Object>> chain = new ArrayList<>();
        for (SpeciesEntry e : evolutionChain) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", e.id());
            row.put("name", e.name());
            row.put("evolves_from_species_id", e.evolvesFromSpeciesId());
            chain.add(row);
        }
        species.put("evolution_chain", chain);
        out.put("species", species);
        return out;
    }
}
