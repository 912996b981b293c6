package com.example.pokebattle.persistence;

import com.example.pokebattle.error.DataAccessException;
import com.example.pokebattle.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * Pokemon reference data in an embedded H2 database.
 *
 * Tables:
 * - move: one row per move, with its optional secondary status and chance
 * - pokemon: base stats and species / evolution ids
 * - pokemon_type, pokemon_ability: ordered by slot
 * - pokemon_move: level-up learnset, ordered by level then move name
 *
 * Names are stored lowercase and matched case-insensitively.
 */
public class PokemonDAO implements PokemonDataSource {

    private static final Logger logger = LoggerFactory.getLogger(PokemonDAO.class);

    public static final String DEFAULT_URL = "jdbc:h2:file:./data/pokebattle;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1";
    private static final String USER = "sa";
    private static final String PASS = "";

    /** Moves a Pokemon brings to a battle, taken from the front of its learnset */
    public static final int BATTLE_MOVE_LIMIT = 4;

    /** Learnset entries listed in the info document */
    public static final int DOCUMENT_MOVE_LIMIT = 20;

    private static final String MOVE_COLUMNS =
        "m.name, m.type_name, m.damage_class, m.power, m.accuracy, m.status_effect, m.effect_chance, m.short_effect";

    private final String url;

    public PokemonDAO(String url) {
        this.url = Objects.requireNonNull(url, "url");
        MigrationManager.ensureSchema(url, "PokemonDAO", this::ensureTables);
    }

    public String getUrl() {
        return url;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(url, USER, PASS);
    }

    private void ensureTables() {
        try (Connection c = connect();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS move (
                    name VARCHAR(100) PRIMARY KEY,
                    type_name VARCHAR(20) NOT NULL,
                    damage_class VARCHAR(20) NOT NULL,
                    power INT,
                    accuracy INT,
                    status_effect VARCHAR(20),
                    effect_chance INT,
                    short_effect VARCHAR(1000)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS pokemon (
                    name VARCHAR(100) PRIMARY KEY,
                    species_id INT,
                    evolves_from_species_id INT,
                    evolution_chain_id INT,
                    hp INT,
                    attack INT,
                    defense INT,
                    special_attack INT,
                    special_defense INT,
                    speed INT
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS pokemon_type (
                    pokemon_name VARCHAR(100) NOT NULL,
                    slot INT NOT NULL,
                    type_name VARCHAR(20) NOT NULL,
                    PRIMARY KEY (pokemon_name, slot)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS pokemon_ability (
                    pokemon_name VARCHAR(100) NOT NULL,
                    slot INT NOT NULL,
                    ability_name VARCHAR(100) NOT NULL,
                    is_hidden BOOLEAN DEFAULT FALSE,
                    short_effect VARCHAR(1000),
                    PRIMARY KEY (pokemon_name, slot)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS pokemon_move (
                    pokemon_name VARCHAR(100) NOT NULL,
                    move_name VARCHAR(100) NOT NULL,
                    level INT DEFAULT 1,
                    PRIMARY KEY (pokemon_name, move_name)
                )
            """);
            s.execute("CREATE INDEX IF NOT EXISTS idx_pokemon_chain ON pokemon(evolution_chain_id)");
            logger.info("[PokemonDAO] Tables ensured on {}", url);
        } catch (SQLException e) {
            throw new DataAccessException("Failed to ensure Pokemon tables: " + e.getMessage(), e);
        }
    }

    // --- writes (used by the seed loader) ---

    public void saveMove(Move move) {
        String sql = "MERGE INTO move (name, type_name, damage_class, power, accuracy, status_effect, effect_chance, short_effect) "
            + "KEY(name) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, normalize(move.getName()));
            ps.setString(2, move.getType().getKey());
            ps.setString(3, move.getCategory().getKey());
            ps.setInt(4, move.getPower());
            ps.setInt(5, move.getAccuracy());
            SecondaryEffect effect = move.getSecondaryEffect();
            if (effect != null) {
                ps.setString(6, effect.status().getKey());
                ps.setInt(7, effect.chancePercent());
            } else {
                ps.setNull(6, Types.VARCHAR);
                ps.setNull(7, Types.INTEGER);
            }
            ps.setString(8, move.getShortEffect());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DataAccessException("Failed to save move " + move.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Insert or replace a Pokemon with its types, abilities and learnset.
     *
     * @param learnset move name to the level it is learned at; every move must already exist
     */
    public void savePokemon(String name, Integer speciesId, Integer evolvesFromSpeciesId, Integer evolutionChainId,
                            Map<Stat, Integer> baseStats, List<PokemonType> types,
                            List<ProfileDocument.Ability> abilities, Map<String, Integer> learnset) {
        String key = normalize(name);
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "MERGE INTO pokemon (name, species_id, evolves_from_species_id, evolution_chain_id, "
                            + "hp, attack, defense, special_attack, special_defense, speed) "
                            + "KEY(name) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    ps.setString(1, key);
                    setNullableInt(ps, 2, speciesId);
                    setNullableInt(ps, 3, evolvesFromSpeciesId);
                    setNullableInt(ps, 4, evolutionChainId);
                    int idx = 5;
                    for (Stat stat : Stat.values()) {
                        setNullableInt(ps, idx++, baseStats == null ? null : baseStats.get(stat));
                    }
                    ps.executeUpdate();
                }

                for (String table : List.of("pokemon_type", "pokemon_ability", "pokemon_move")) {
                    try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE pokemon_name = ?")) {
                        ps.setString(1, key);
                        ps.executeUpdate();
                    }
                }

                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO pokemon_type (pokemon_name, slot, type_name) VALUES (?, ?, ?)")) {
                    int slot = 1;
                    for (PokemonType t : types) {
                        ps.setString(1, key);
                        ps.setInt(2, slot++);
                        ps.setString(3, t.getKey());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }

                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO pokemon_ability (pokemon_name, slot, ability_name, is_hidden, short_effect) "
                            + "VALUES (?, ?, ?, ?, ?)")) {
                    for (ProfileDocument.Ability a : abilities) {
                        ps.setString(1, key);
                        ps.setInt(2, a.slot());
                        ps.setString(3, normalize(a.name()));
                        ps.setBoolean(4, a.hidden());
                        ps.setString(5, a.shortEffect());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }

                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO pokemon_move (pokemon_name, move_name, level) VALUES (?, ?, ?)")) {
                    for (Map.Entry<String, Integer> e : learnset.entrySet()) {
                        ps.setString(1, key);
                        ps.setString(2, normalize(e.getKey()));
                        ps.setInt(3, e.getValue() == null ? 1 : e.getValue());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to save pokemon " + name + ": " + e.getMessage(), e);
        }
    }

    // --- reads ---

    @Override
    public Optional<Move> lookupMove(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement("SELECT " + MOVE_COLUMNS + " FROM move m WHERE m.name = ?")) {
            ps.setString(1, normalize(name));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readMove(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to look up move " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Battle profile. The battle move list is the first {@value #BATTLE_MOVE_LIMIT}
     * learnset entries, keeping damaging moves and status moves that inflict a status.
     */
    @Override
    public Optional<PokemonBaseProfile> lookupProfile(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try (Connection c = connect()) {
            PokemonRow row = readPokemonRow(c, name);
            if (row == null) return Optional.empty();

            List<Move> battleMoves = new ArrayList<>();
            for (Move m : readLearnset(c, row.name, BATTLE_MOVE_LIMIT)) {
                if (m.isDamaging() || m.hasSecondaryEffect()) {
                    battleMoves.add(m);
                }
            }
            logger.debug("[PokemonDAO] Loaded battle profile {} with moves {}", row.name, battleMoves);
            return Optional.of(new PokemonBaseProfile(row.name, row.stats, readTypes(c, row.name), battleMoves));
        } catch (SQLException e) {
            throw new DataAccessException("Failed to look up pokemon " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ProfileDocument> lookupDocument(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try (Connection c = connect()) {
            PokemonRow row = readPokemonRow(c, name);
            if (row == null) return Optional.empty();
            return Optional.of(new ProfileDocument(row.name, row.stats, readTypes(c, row.name),
                readAbilities(c, row.name), readLearnset(c, row.name, DOCUMENT_MOVE_LIMIT),
                row.speciesId, row.evolvesFromSpeciesId, row.evolutionChainId,
                readEvolutionChain(c, row.evolutionChainId)));
        } catch (SQLException e) {
            throw new DataAccessException("Failed to look up pokemon " + name + ": " + e.getMessage(), e);
        }
    }

    public int countPokemon() {
        return count("SELECT COUNT(*) FROM pokemon");
    }

    public int countMoves() {
        return count("SELECT COUNT(*) FROM move");
    }

    /** All stored Pokemon names, alphabetically. */
    public List<String> listPokemonNames() {
        List<String> out = new ArrayList<>();
        try (Connection c = connect();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT name FROM pokemon ORDER BY name")) {
            while (rs.next()) out.add(rs.getString(1));
        } catch (SQLException e) {
            throw new DataAccessException("Failed to list pokemon: " + e.getMessage(), e);
        }
        return out;
    }

    private int count(String sql) {
        try (Connection c = connect();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DataAccessException("Count failed: " + e.getMessage(), e);
        }
    }

    private record PokemonRow(String name, Integer speciesId, Integer evolvesFromSpeciesId,
                              Integer evolutionChainId, Map<Stat, Integer> stats) { }

    private PokemonRow readPokemonRow(Connection c, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT name, species_id, evolves_from_species_id, evolution_chain_id, "
                    + "hp, attack, defense, special_attack, special_defense, speed FROM pokemon WHERE name = ?")) {
            ps.setString(1, normalize(name));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                Map<Stat, Integer> stats = new EnumMap<>(Stat.class);
                for (Stat stat : Stat.values()) {
                    Integer v = getNullableInt(rs, stat.name().toLowerCase());
                    if (v != null) stats.put(stat, v);
                }
                return new PokemonRow(rs.getString("name"), getNullableInt(rs, "species_id"),
                    getNullableInt(rs, "evolves_from_species_id"), getNullableInt(rs, "evolution_chain_id"), stats);
            }
        }
    }

    private List<PokemonType> readTypes(Connection c, String pokemonName) throws SQLException {
        List<PokemonType> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT type_name FROM pokemon_type WHERE pokemon_name = ? ORDER BY slot")) {
            ps.setString(1, pokemonName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(PokemonType.fromString(rs.getString(1)));
            }
        }
        return out;
    }

    private List<ProfileDocument.Ability> readAbilities(Connection c, String pokemonName) throws SQLException {
        List<ProfileDocument.Ability> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT ability_name, slot, is_hidden, short_effect FROM pokemon_ability "
                    + "WHERE pokemon_name = ? ORDER BY slot")) {
            ps.setString(1, pokemonName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ProfileDocument.Ability(rs.getString("ability_name"), rs.getInt("slot"),
                        rs.getBoolean("is_hidden"), rs.getString("short_effect")));
                }
            }
        }
        return out;
    }

    private List<Move> readLearnset(Connection c, String pokemonName, int limit) throws SQLException {
        List<Move> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + MOVE_COLUMNS + " FROM pokemon_move pm JOIN move m ON pm.move_name = m.name "
                    + "WHERE pm.pokemon_name = ? ORDER BY pm.level, m.name LIMIT ?")) {
            ps.setString(1, pokemonName);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(readMove(rs));
            }
        }
        return out;
    }

    private List<ProfileDocument.SpeciesEntry> readEvolutionChain(Connection c, Integer chainId) throws SQLException {
        List<ProfileDocument.SpeciesEntry> out = new ArrayList<>();
        if (chainId == null) return out;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT species_id, name, evolves_from_species_id FROM pokemon "
                    + "WHERE evolution_chain_id = ? AND species_id IS NOT NULL ORDER BY species_id")) {
            ps.setInt(1, chainId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ProfileDocument.SpeciesEntry(rs.getInt("species_id"), rs.getString("name"),
                        getNullableInt(rs, "evolves_from_species_id")));
                }
            }
        }
        return out;
    }

    private static Move readMove(ResultSet rs) throws SQLException {
        MoveCategory category = MoveCategory.fromString(rs.getString("damage_class"));
        Integer power = getNullableInt(rs, "power");
        Integer accuracy = getNullableInt(rs, "accuracy");
        String status = rs.getString("status_effect");
        Integer chance = getNullableInt(rs, "effect_chance");
        SecondaryEffect effect = null;
        if (status != null && !status.isBlank() && chance != null && chance > 0) {
            effect = new SecondaryEffect(StatusType.fromString(status), chance);
        }
        return new Move(rs.getString("name"), PokemonType.fromString(rs.getString("type_name")), category,
            power == null ? 0 : power,
            accuracy == null ? 100 : accuracy,
            effect, rs.getString("short_effect"));
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private static void setNullableInt(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, value);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase();
    }
}
