package com.example.pokebattle.tool;

import com.example.pokebattle.combat.BattleResult;
import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.service.BattleSimulationService;

import java.util.List;
import java.util.Map;

/**
 * simulate_pokemon_battle(pokemon1_name, pokemon2_name, detailed?)
 */
public class SimulateBattleTool implements ToolHandler {

    public static final String NAME = "simulate_pokemon_battle";

    private static final ToolDefinition DEFINITION = new ToolDefinition(NAME,
        "Simulate a battle between two Pokemon at level 50 with type effectiveness, STAB, "
            + "critical hits, speed order and status effects",
        List.of(
            new ToolDefinition.Parameter("pokemon1_name", "string", true, "First Pokemon; wins speed ties"),
            new ToolDefinition.Parameter("pokemon2_name", "string", true, "Second Pokemon"),
            new ToolDefinition.Parameter("detailed", "boolean", false, "Include the turn-by-turn log (default true)")
        ));

    private final BattleSimulationService service;

    public SimulateBattleTool(BattleSimulationService service) {
        this.service = service;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public Map<String, Object> handle(Map<String, Object> arguments) {
        String name1 = ToolArguments.requireString(arguments, "pokemon1_name");
        String name2 = ToolArguments.requireString(arguments, "pokemon2_name");
        Object detailedArg = arguments.get("detailed");
        boolean detailed = true;
        if (detailedArg != null) {
            if (!(detailedArg instanceof Boolean)) {
                throw new InvalidArgumentException("detailed must be a boolean, got: " + detailedArg);
            }
            detailed = (Boolean) detailedArg;
        }
        BattleResult result = service.simulateBattle(name1, name2, detailed);
        return result.toPayload();
    }
}
