package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Damage-over-time status (burn, poison). Loses a fixed fraction of max HP at the
 * end of every turn, at least 1, and never wears off on its own.
 */
public class DotStatus implements StatusHandler {

    private final StatusType type;
    private final int divisor;
    private final String sourceText;

    /**
     * @param divisor fraction of max HP lost per tick, as 1/divisor
     * @param sourceText phrase in "Charizard is hurt by {sourceText}!"
     */
    public DotStatus(StatusType type, int divisor, String sourceText) {
        this.type = type;
        this.divisor = divisor;
        this.sourceText = sourceText;
    }

    public static DotStatus burn() {
        return new DotStatus(StatusType.BURN, 16, "its burn");
    }

    public static DotStatus poison() {
        return new DotStatus(StatusType.POISON, 8, "poison");
    }

    @Override
    public StatusType getType() {
        return type;
    }

    @Override
    public StatusCondition create(RandomSource rng) {
        return new StatusCondition(type, 0);
    }

    public int tickDamage(Combatant combatant) {
        return Math.max(1, combatant.getMaxHp() / divisor);
    }

    @Override
    public String endOfTurn(Combatant combatant, RandomSource rng) {
        int dealt = combatant.applyDamage(tickDamage(combatant));
        return combatant.getName() + " is hurt by " + sourceText + "! (-" + dealt + " HP)";
    }
}
