package com.example.pokebattle.error;

/**
 * Malformed request: blank names, disallowed mirror matches, wrongly typed arguments
 * or bad configuration values.
 */
public class InvalidArgumentException extends PokemonBattleException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "invalid_argument";
    }
}
