package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Behaviour of one status condition. Each status has one handler registered in
 * {@link StatusRules}.
 */
public interface StatusHandler {

    StatusType getType();

    /**
     * Build the condition placed in the slot when this status is inflicted.
     * Timed statuses draw their duration here.
     */
    StatusCondition create(RandomSource rng);

    /**
     * Pre-action gate, evaluated before the combatant's move each turn.
     */
    default GateResult beforeAction(Combatant combatant, RandomSource rng) {
        return GateResult.proceed();
    }

    /**
     * Post-action tick, evaluated at the end of each turn for standing combatants.
     *
     * @return a log line, or null if nothing happened
     */
    default String endOfTurn(Combatant combatant, RandomSource rng) {
        return null;
    }
}
