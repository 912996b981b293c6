package com.example.pokebattle.tool;

import com.example.pokebattle.service.PokemonInfoService;

import java.util.List;
import java.util.Map;

/**
 * get_pokemon_info(name)
 */
public class PokemonInfoTool implements ToolHandler {

    public static final String NAME = "get_pokemon_info";

    private static final ToolDefinition DEFINITION = new ToolDefinition(NAME,
        "Stats, types, abilities, level-up moves and evolution data for one Pokemon",
        List.of(new ToolDefinition.Parameter("name", "string", true, "Pokemon name, any case")));

    private final PokemonInfoService service;

    public PokemonInfoTool(PokemonInfoService service) {
        this.service = service;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public Map<String, Object> handle(Map<String, Object> arguments) {
        return service.getPokemonInfo(ToolArguments.requireString(arguments, "name")).toPayload();
    }
}
