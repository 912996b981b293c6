package com.example.pokebattle.effect;

import java.util.List;

/**
 * Outcome of a pre-action status check: whether the combatant may use its move this
 * turn, plus the log lines produced by the check.
 */
public record GateResult(boolean canAct, List<String> messages) {

    private static final GateResult PROCEED = new GateResult(true, List.of());

    public GateResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static GateResult proceed() {
        return PROCEED;
    }

    public static GateResult skip(String... messages) {
        return new GateResult(false, List.of(messages));
    }
}
