package com.example.pokebattle.error;

/**
 * Base type for request-scoped failures raised by the battle simulator.
 * Each subtype maps to one {@code error_type} value at the tool boundary.
 */
public abstract class PokemonBattleException extends RuntimeException {

    protected PokemonBattleException(String message) {
        super(message);
    }

    protected PokemonBattleException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable kind used in error payloads.
     */
    public abstract String getErrorType();
}
