package com.example.pokebattle.error;

/**
 * Wraps a storage failure from the reference database.
 */
public class DataAccessException extends PokemonBattleException {

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "data_access";
    }
}
