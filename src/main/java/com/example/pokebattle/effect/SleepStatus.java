package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Sleep: the combatant skips its action every turn while the counter is positive.
 * The counter drops after each skipped turn; at 0 the combatant wakes and acts
 * normally from the next turn on.
 */
public class SleepStatus implements StatusHandler {

    public static final int MIN_TURNS = 1;
    public static final int MAX_TURNS = 3;

    @Override
    public StatusType getType() {
        return StatusType.SLEEP;
    }

    @Override
    public StatusCondition create(RandomSource rng) {
        return StatusCondition.sleep(rng.nextIntInclusive(MIN_TURNS, MAX_TURNS));
    }

    @Override
    public GateResult beforeAction(Combatant combatant, RandomSource rng) {
        StatusCondition next = combatant.getStatus().decrement();
        String asleep = combatant.getName() + " is fast asleep!";
        if (next.turnsLeft() <= 0) {
            combatant.clearStatus();
            return GateResult.skip(asleep, combatant.getName() + " woke up!");
        }
        combatant.setStatus(next);
        return GateResult.skip(asleep);
    }
}
