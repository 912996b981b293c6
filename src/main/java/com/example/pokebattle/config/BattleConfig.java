package com.example.pokebattle.config;

import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.persistence.PokemonDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.function.Function;

/**
 * Battle settings. Each key is resolved from, in order of precedence:
 * environment variable, system property, the YAML resource, the built-in default.
 *
 * <pre>
 * key                 property                        environment
 * max-turns           pokebattle.max-turns            POKEBATTLE_MAX_TURNS
 * seed                pokebattle.seed                 POKEBATTLE_SEED
 * allow-mirror-match  pokebattle.allow-mirror-match   POKEBATTLE_ALLOW_MIRROR_MATCH
 * db-url              pokebattle.db.url               POKEBATTLE_DB_URL
 * </pre>
 */
public final class BattleConfig {

    private static final Logger logger = LoggerFactory.getLogger(BattleConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/battle.yaml";
    public static final int DEFAULT_MAX_TURNS = 100;

    private final int maxTurns;
    /** null means unseeded */
    private final Long seed;
    private final boolean allowMirrorMatch;
    private final String dbUrl;

    public BattleConfig(int maxTurns, Long seed, boolean allowMirrorMatch, String dbUrl) {
        if (maxTurns < 1) {
            throw new InvalidArgumentException("max-turns must be at least 1, got " + maxTurns);
        }
        if (dbUrl == null || dbUrl.isBlank()) {
            throw new InvalidArgumentException("db-url must not be blank");
        }
        this.maxTurns = maxTurns;
        this.seed = seed;
        this.allowMirrorMatch = allowMirrorMatch;
        this.dbUrl = dbUrl;
    }

    public static BattleConfig defaults() {
        return new BattleConfig(DEFAULT_MAX_TURNS, null, true, PokemonDAO.DEFAULT_URL);
    }

    /** Load from the default resource with the process environment and system properties. */
    public static BattleConfig load() {
        return load(DEFAULT_RESOURCE, System::getenv, System::getProperty);
    }

    /**
     * @param resourcePath classpath resource; a missing resource falls back to defaults
     * @param env environment lookup
     * @param props system property lookup
     */
    public static BattleConfig load(String resourcePath, Function<String, String> env,
                                    Function<String, String> props) {
        Map<String, Object> file = readYaml(resourcePath);

        int maxTurns = parseInt("max-turns",
            resolve("max-turns", "pokebattle.max-turns", "POKEBATTLE_MAX_TURNS", file, env, props),
            DEFAULT_MAX_TURNS);
        String seedValue = resolve("seed", "pokebattle.seed", "POKEBATTLE_SEED", file, env, props);
        Long seed = seedValue == null ? null : parseLong("seed", seedValue);
        boolean mirror = parseBoolean("allow-mirror-match",
            resolve("allow-mirror-match", "pokebattle.allow-mirror-match", "POKEBATTLE_ALLOW_MIRROR_MATCH",
                file, env, props),
            true);
        String dbUrl = resolve("db-url", "pokebattle.db.url", "POKEBATTLE_DB_URL", file, env, props);

        BattleConfig config = new BattleConfig(maxTurns, seed, mirror, dbUrl == null ? PokemonDAO.DEFAULT_URL : dbUrl);
        logger.info("[BattleConfig] {}", config);
        return config;
    }

    private static String resolve(String key, String property, String envVar, Map<String, Object> file,
                                  Function<String, String> env, Function<String, String> props) {
        String v = env.apply(envVar);
        if (v != null && !v.isBlank()) return v.trim();
        v = props.apply(property);
        if (v != null && !v.isBlank()) return v.trim();
        Object f = file.get(key);
        return f == null ? null : String.valueOf(f).trim();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readYaml(String resourcePath) {
        try (InputStream in = BattleConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.debug("[BattleConfig] No resource at {}, using defaults", resourcePath);
                return Map.of();
            }
            Object root = new Yaml().load(in);
            if (root == null) return Map.of();
            if (!(root instanceof Map)) {
                throw new InvalidArgumentException("Config " + resourcePath + " is not a mapping");
            }
            return (Map<String, Object>) root;
        } catch (IOException e) {
            throw new InvalidArgumentException("Failed to read config " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    private static int parseInt(String key, String value, int defaultVal) {
        if (value == null) return defaultVal;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value, boolean defaultVal) {
        if (value == null) return defaultVal;
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new InvalidArgumentException("Invalid " + key + ": " + value);
    }

    public int getMaxTurns() { return maxTurns; }
    public Long getSeed() { return seed; }
    public boolean hasSeed() { return seed != null; }
    public boolean isAllowMirrorMatch() { return allowMirrorMatch; }
    public String getDbUrl() { return dbUrl; }

    @Override
    public String toString() {
        return String.format("BattleConfig[maxTurns=%d, seed=%s, allowMirrorMatch=%s, dbUrl=%s]",
            maxTurns, seed, allowMirrorMatch, dbUrl);
    }
}
