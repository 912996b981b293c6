package com.example.pokebattle.tool;

import com.example.pokebattle.error.InvalidArgumentException;

import java.util.Map;

final class ToolArguments {

    private ToolArguments() { }

    static String requireString(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value == null) {
            throw new InvalidArgumentException("Missing argument: " + key);
        }
        if (!(value instanceof String)) {
            throw new InvalidArgumentException(key + " must be a string");
        }
        String s = ((String) value).trim();
        if (s.isEmpty()) {
            throw new InvalidArgumentException(key + " must not be blank");
        }
        return s;
    }
}
