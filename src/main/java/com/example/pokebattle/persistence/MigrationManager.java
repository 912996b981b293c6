package com.example.pokebattle.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which schema setups have completed in this JVM, per database URL and
 * component. Every DAO on one database shares a single setup run; each in-memory
 * test database gets its own.
 */
public final class MigrationManager {

    private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);

    /** "component@url" -> epoch millis at completion */
    private static final Map<String, Long> completed = new ConcurrentHashMap<>();

    private MigrationManager() { }

    /**
     * Run {@code setup} for {@code component} on {@code dbUrl} unless it already completed.
     * A setup that throws is not recorded and runs again on the next call.
     */
    public static void ensureSchema(String dbUrl, String component, Runnable setup) {
        String key = key(dbUrl, component);
        if (completed.containsKey(key)) return;
        synchronized (MigrationManager.class) {
            if (completed.containsKey(key)) return;
            long start = System.nanoTime();
            setup.run();
            completed.put(key, System.currentTimeMillis());
            logger.debug("[MigrationManager] {} ready in {} ms", key, (System.nanoTime() - start) / 1_000_000);
        }
    }

    static boolean isReady(String dbUrl, String component) {
        return completed.containsKey(key(dbUrl, component));
    }

    private static String key(String dbUrl, String component) {
        return component + "@" + (dbUrl == null ? "default" : dbUrl);
    }
}
