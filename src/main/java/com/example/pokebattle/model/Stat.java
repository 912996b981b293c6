package com.example.pokebattle.model;

/**
 * The six base stats every Pokemon carries. The key is the token used by the
 * reference data ("special-attack" etc).
 */
public enum Stat {
    HP("hp"),
    ATTACK("attack"),
    DEFENSE("defense"),
    SPECIAL_ATTACK("special-attack"),
    SPECIAL_DEFENSE("special-defense"),
    SPEED("speed");

    private final String key;

    Stat(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve a reference-data token. Returns null for unknown keys so callers can
     * skip stats the battle model does not use (e.g. accuracy/evasion rows).
     */
    public static Stat fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        for (Stat s : values()) {
            if (s.key.equals(k) || s.name().equalsIgnoreCase(k)) {
                return s;
            }
        }
        return null;
    }
}
