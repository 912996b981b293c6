package com.example.pokebattle.model;

import com.example.pokebattle.error.DataIntegrityException;

/**
 * Kinds of status condition. NONE is the empty slot.
 */
public enum StatusType {
    NONE("none", "healthy"),
    BURN("burn", "burned"),
    POISON("poison", "poisoned"),
    PARALYSIS("paralysis", "paralyzed"),
    SLEEP("sleep", "asleep"),
    FREEZE("freeze", "frozen"),
    CONFUSION("confusion", "confused");

    private final String key;
    private final String adjective;

    StatusType(String key, String adjective) {
        this.key = key;
        this.adjective = adjective;
    }

    public String getKey() {
        return key;
    }

    /** Word used in log lines: "Pikachu is now paralyzed!" */
    public String getAdjective() {
        return adjective;
    }

    public static StatusType fromString(String token) {
        if (token == null || token.isBlank()) {
            throw new DataIntegrityException("Missing status token");
        }
        String t = token.trim().toLowerCase();
        for (StatusType s : values()) {
            if (s.key.equals(t) || s.name().equalsIgnoreCase(t)) {
                return s;
            }
        }
        throw new DataIntegrityException("Unknown status: " + token);
    }
}
