package com.example.pokebattle.tool;

import java.util.Collections;
import java.util.List;

/**
 * Metadata for one tool exposed to the agent host.
 */
public class ToolDefinition {

    /**
     * One named argument of a tool.
     */
    public record Parameter(String name, String type, boolean required, String description) { }

    private final String name;
    private final String description;
    private final List<Parameter> parameters;

    public ToolDefinition(String name, String description, List<Parameter> parameters) {
        this.name = name;
        this.description = description;
        this.parameters = parameters == null ? Collections.emptyList() : List.copyOf(parameters);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<Parameter> getParameters() { return parameters; }

    /**
     * Returns "name(arg1, arg2?)" for listings; optional arguments carry a question mark.
     */
    public String getSignature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            Parameter p = parameters.get(i);
            sb.append(p.name());
            if (!p.required()) sb.append('?');
        }
        return sb.append(')').toString();
    }
}
