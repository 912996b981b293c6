package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Paralysis: 25% chance each turn that the combatant cannot act. Halves effective
 * Speed for turn order (see {@link Combatant#getEffectiveSpeed()}). Permanent.
 */
public class ParalyzedStatus implements StatusHandler {

    public static final double FULL_PARALYSIS_CHANCE = 0.25;

    @Override
    public StatusType getType() {
        return StatusType.PARALYSIS;
    }

    @Override
    public StatusCondition create(RandomSource rng) {
        return StatusCondition.paralysis();
    }

    @Override
    public GateResult beforeAction(Combatant combatant, RandomSource rng) {
        if (rng.chance(FULL_PARALYSIS_CHANCE)) {
            return GateResult.skip(combatant.getName() + " is fully paralyzed! It can't move!");
        }
        return GateResult.proceed();
    }
}
