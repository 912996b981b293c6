package com.example.pokebattle.error;

/**
 * Reference data is incomplete or malformed (missing base stats, bad type tokens).
 * Fatal to the request that hit it only.
 */
public class DataIntegrityException extends PokemonBattleException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "data_integrity";
    }
}
