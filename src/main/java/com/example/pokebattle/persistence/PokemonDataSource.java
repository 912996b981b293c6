package com.example.pokebattle.persistence;

import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.model.ProfileDocument;

import java.util.Optional;

/**
 * Read-only access to Pokemon reference data. Name matching is case-insensitive.
 */
public interface PokemonDataSource {

    /**
     * Battle-ready profile: base stats, types and the moves the Pokemon brings to a battle.
     */
    Optional<PokemonBaseProfile> lookupProfile(String name);

    Optional<Move> lookupMove(String name);

    /**
     * Full informational document, including abilities, the level-up learnset and
     * evolution data.
     */
    Optional<ProfileDocument> lookupDocument(String name);
}
