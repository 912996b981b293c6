package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Freeze: the combatant cannot act while frozen. Each end of turn it has a flat 20%
 * chance to thaw, independent of how long it has been frozen.
 */
public class FrozenStatus implements StatusHandler {

    public static final double THAW_CHANCE = 0.20;

    @Override
    public StatusType getType() {
        return StatusType.FREEZE;
    }

    @Override
    public StatusCondition create(RandomSource rng) {
        return StatusCondition.freeze();
    }

    @Override
    public GateResult beforeAction(Combatant combatant, RandomSource rng) {
        return GateResult.skip(combatant.getName() + " is frozen solid!");
    }

    @Override
    public String endOfTurn(Combatant combatant, RandomSource rng) {
        if (rng.chance(THAW_CHANCE)) {
            combatant.clearStatus();
            return combatant.getName() + " thawed out!";
        }
        return null;
    }
}
