package com.example.pokebattle.error;

/**
 * An unknown Pokemon name. Surfaced verbatim to the caller, never retried.
 */
public class NotFoundException extends PokemonBattleException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException pokemon(String name) {
        return new NotFoundException("Pokemon not found: " + name);
    }

    @Override
    public String getErrorType() {
        return "not_found";
    }
}
