package com.example.pokebattle.tool;

import com.example.pokebattle.service.BattleSimulationService;
import com.example.pokebattle.service.PokemonInfoService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registered tools by name, in registration order.
 */
public class ToolRegistry {

    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();

    /** Registry with both Pokemon tools. */
    public static ToolRegistry withDefaults(BattleSimulationService battleService, PokemonInfoService infoService) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new SimulateBattleTool(battleService));
        registry.register(new PokemonInfoTool(infoService));
        return registry;
    }

    public void register(ToolHandler handler) {
        String name = handler.getName();
        if (handlers.containsKey(name)) {
            throw new IllegalStateException("Tool already registered: " + name);
        }
        handlers.put(name, handler);
    }

    /** @return the handler, or null if no tool has that name */
    public ToolHandler getHandler(String name) {
        return name == null ? null : handlers.get(name);
    }

    public List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> defs = new ArrayList<>();
        for (ToolHandler h : handlers.values()) defs.add(h.getDefinition());
        return Collections.unmodifiableList(defs);
    }
}
