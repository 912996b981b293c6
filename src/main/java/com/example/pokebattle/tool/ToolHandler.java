package com.example.pokebattle.tool;

import java.util.Map;

/**
 * Handler for a single tool. Handlers validate their own arguments and throw
 * the battle exception types on failure; the dispatcher turns those into error payloads.
 */
public interface ToolHandler {

    ToolDefinition getDefinition();

    /**
     * Execute the tool.
     *
     * @param arguments tool arguments by name, never null
     * @return the result payload
     */
    Map<String, Object> handle(Map<String, Object> arguments);

    default String getName() {
        return getDefinition().getName();
    }
}
