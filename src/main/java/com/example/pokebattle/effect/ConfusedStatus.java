package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.combat.DamageCalculator;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Confusion: each turn there is a 50% chance the combatant hits itself with a
 * typeless 40-power physical attack instead of using its move. The counter drops
 * after every check; at 0 the combatant snaps out of it.
 */
public class ConfusedStatus implements StatusHandler {

    public static final double SELF_HIT_CHANCE = 0.5;
    public static final int MIN_TURNS = 2;
    public static final int MAX_TURNS = 5;

    @Override
    public StatusType getType() {
        return StatusType.CONFUSION;
    }

    @Override
    public StatusCondition create(RandomSource rng) {
        return StatusCondition.confusion(rng.nextIntInclusive(MIN_TURNS, MAX_TURNS));
    }

    @Override
    public GateResult beforeAction(Combatant combatant, RandomSource rng) {
        List<String> messages = new ArrayList<>();
        messages.add(combatant.getName() + " is confused!");
        boolean selfHit = rng.chance(SELF_HIT_CHANCE);
        if (selfHit) {
            int dealt = combatant.applyDamage(DamageCalculator.confusionSelfDamage(combatant));
            messages.add(combatant.getName() + " hurt itself in its confusion! (-" + dealt + " HP)");
        }

        StatusCondition next = combatant.getStatus().decrement();
        if (next.turnsLeft() <= 0) {
            combatant.clearStatus();
            messages.add(combatant.getName() + " snapped out of confusion!");
        } else {
            combatant.setStatus(next);
        }
        return new GateResult(!selfHit, messages);
    }
}
