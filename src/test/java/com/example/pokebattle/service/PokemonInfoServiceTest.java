package com.example.pokebattle.service;

import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.error.NotFoundException;
import com.example.pokebattle.model.ProfileDocument;
import com.example.pokebattle.persistence.DataLoader;
import com.example.pokebattle.persistence.PokemonDAO;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PokemonInfoService Tests")
class PokemonInfoServiceTest {

    private static PokemonInfoService service;

    @BeforeAll
    static void seed() {
        PokemonDAO dao = new PokemonDAO("jdbc:h2:mem:info_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DataLoader.loadDefaults(dao);
        service = new PokemonInfoService(dao);
    }

    @Test
    @DisplayName("Returns the full profile document")
    @SuppressWarnings("unchecked")
    void fullDocument() {
        ProfileDocument doc = service.getPokemonInfo("Charizard");
        Map<String, Object> payload = doc.toPayload();

        assertEquals("charizard", payload.get("name"));
        assertEquals(List.of("fire", "flying"), payload.get("types"));

        List<Map<String, Object>> stats = (List<Map<String, Object>>) payload.get("stats");
        assertEquals(6, stats.size());
        assertEquals("hp", stats.get(0).get("stat"));
        assertEquals(78, stats.get(0).get("base_stat"));

        List<Map<String, Object>> moves = (List<Map<String, Object>>) payload.get("moves");
        assertEquals(7, moves.size());
        Map<String, Object> flamethrower = moves.get(2);
        assertEquals("flamethrower", flamethrower.get("name"));
        assertEquals("special", flamethrower.get("damage_class"));
        assertEquals(10, flamethrower.get("effect_chance"));

        Map<String, Object> species = (Map<String, Object>) payload.get("species");
        assertEquals(5, species.get("evolves_from_species_id"));
        assertFalse(species.containsKey("id"));
        List<Map<String, Object>> chain = (List<Map<String, Object>>) species.get("evolution_chain");
        assertEquals(List.of("charmander", "charmeleon", "charizard"),
            chain.stream().map(m -> m.get("name")).toList());
    }

    @Test
    @DisplayName("Unknown Pokemon is not found")
    void unknown() {
        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.getPokemonInfo("missingno"));
        assertEquals("Pokemon not found: missingno", ex.getMessage());
    }

    @Test
    @DisplayName("Blank name is invalid")
    void blank() {
        assertThrows(InvalidArgumentException.class, () -> service.getPokemonInfo(" "));
    }
}
