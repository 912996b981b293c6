package com.example.pokebattle.combat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the battle log: the turn number and every action line, in order.
 */
public record TurnRecord(int turn, List<String> actions) {

    public TurnRecord {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("turn", turn);
        out.put("actions", actions);
        return out;
    }
}
