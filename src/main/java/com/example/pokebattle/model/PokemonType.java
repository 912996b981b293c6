package com.example.pokebattle.model;

import com.example.pokebattle.error.DataIntegrityException;

/**
 * The eighteen elemental types. Ordinal order is the row/column order of the type chart.
 */
public enum PokemonType {
    NORMAL,
    FIRE,
    WATER,
    ELECTRIC,
    GRASS,
    ICE,
    FIGHTING,
    POISON,
    GROUND,
    FLYING,
    PSYCHIC,
    BUG,
    ROCK,
    GHOST,
    DRAGON,
    DARK,
    STEEL,
    FAIRY;

    /** Lower-case token as used by the reference data. */
    public String getKey() {
        return name().toLowerCase();
    }

    /**
     * Parse a type token (case-insensitive).
     *
     * @throws DataIntegrityException if the token is blank or not one of the eighteen types
     */
    public static PokemonType fromString(String token) {
        if (token == null || token.isBlank()) {
            throw new DataIntegrityException("Missing type token");
        }
        try {
            return valueOf(token.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new DataIntegrityException("Unknown type: " + token, e);
        }
    }
}
