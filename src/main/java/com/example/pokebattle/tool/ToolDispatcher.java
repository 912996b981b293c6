package com.example.pokebattle.tool;

import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.error.PokemonBattleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes a tool call to its handler and turns every failure into an error payload:
 * {@code {"error": message, "error_type": kind}}. Nothing thrown by a handler escapes.
 */
public class ToolDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

    public static final String INTERNAL_ERROR = "internal";

    private final ToolRegistry registry;

    public ToolDispatcher(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Map<String, Object> dispatch(String toolName, Map<String, Object> arguments) {
        try {
            ToolHandler handler = registry.getHandler(toolName);
            if (handler == null) {
                throw new InvalidArgumentException("Unknown tool: " + toolName);
            }
            return handler.handle(arguments == null ? Map.of() : arguments);
        } catch (PokemonBattleException e) {
            logger.warn("[ToolDispatcher] {} failed ({}): {}", toolName, e.getErrorType(), e.getMessage());
            return errorPayload(e.getMessage(), e.getErrorType());
        } catch (RuntimeException e) {
            logger.error("[ToolDispatcher] Unexpected failure in {}: {}", toolName, e.getMessage(), e);
            return errorPayload("Internal error: " + e.getMessage(), INTERNAL_ERROR);
        }
    }

    static Map<String, Object> errorPayload(String message, String errorType) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        out.put("error_type", errorType);
        return out;
    }
}
