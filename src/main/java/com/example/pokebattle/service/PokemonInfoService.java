package com.example.pokebattle.service;

import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.error.NotFoundException;
import com.example.pokebattle.model.ProfileDocument;
import com.example.pokebattle.persistence.PokemonDataSource;

import java.util.Objects;

/**
 * Read-only profile lookup for informational use.
 */
public class PokemonInfoService {

    private final PokemonDataSource dataSource;

    public PokemonInfoService(PokemonDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public ProfileDocument getPokemonInfo(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("A Pokemon name is required");
        }
        String trimmed = name.trim();
        return dataSource.lookupDocument(trimmed).orElseThrow(() -> NotFoundException.pokemon(trimmed));
    }
}
