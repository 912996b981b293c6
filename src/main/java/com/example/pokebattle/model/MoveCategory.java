package com.example.pokebattle.model;

import com.example.pokebattle.error.DataIntegrityException;

/**
 * Damage class of a move. Physical moves pair Attack with Defense, special moves
 * pair Sp. Atk with Sp. Def, status moves deal no damage.
 */
public enum MoveCategory {
    PHYSICAL,
    SPECIAL,
    STATUS;

    public boolean dealsDamage() {
        return this != STATUS;
    }

    public String getKey() {
        return name().toLowerCase();
    }

    public static MoveCategory fromString(String token) {
        if (token == null || token.isBlank()) {
            throw new DataIntegrityException("Missing move damage class");
        }
        try {
            return valueOf(token.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityException("Unknown move damage class: " + token, e);
        }
    }
}
