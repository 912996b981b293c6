package com.example.pokebattle.combat;

import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.MoveCategory;
import com.example.pokebattle.model.Stat;
import com.example.pokebattle.model.StatusType;

/**
 * Damage formulas for level-50 battles.
 *
 * Base damage: (((2 * level / 5 + 2) * power * (attack / defense)) / 50) + 2
 *
 * Final damage: floor(base * STAB * typeMultiplier * critMultiplier), at least 1
 * unless the type multiplier is 0, in which case the move does nothing.
 *
 * No random 85-100% spread is applied; every multiplier is deterministic once the
 * critical-hit roll is known.
 */
public final class DamageCalculator {

    public static final double STAB_MULTIPLIER = 1.5;

    public static final double CRITICAL_MULTIPLIER = 1.5;

    public static final double CRITICAL_CHANCE = 1.0 / 16.0;

    /** Power of the typeless hit a confused Pokemon deals to itself */
    public static final int CONFUSION_SELF_HIT_POWER = 40;

    private DamageCalculator() { }

    /**
     * Base damage before multipliers.
     *
     * @param power move base power
     * @param attackStat attacker's Attack or Sp. Atk (after burn halving)
     * @param defenseStat defender's Defense or Sp. Def
     */
    public static double baseDamage(int power, int attackStat, int defenseStat) {
        double levelFactor = 2.0 * StatCalculator.LEVEL / 5.0 + 2.0;
        return ((levelFactor * power * ((double) attackStat / Math.max(1, defenseStat))) / 50.0) + 2.0;
    }

    /**
     * Apply the multipliers and floor the result.
     */
    public static int finalDamage(double base, double stab, double typeMultiplier, double critMultiplier) {
        if (typeMultiplier == TypeChart.IMMUNE) {
            return 0;
        }
        int damage = (int) Math.floor(base * stab * typeMultiplier * critMultiplier);
        return Math.max(1, damage);
    }

    public static double stab(Combatant attacker, Move move) {
        return attacker.hasType(move.getType()) ? STAB_MULTIPLIER : 1.0;
    }

    /**
     * Attacking stat matched to the move's category. A burned attacker's Attack
     * counts half for physical moves.
     */
    public static int attackStat(Combatant attacker, Move move) {
        if (move.getCategory() == MoveCategory.SPECIAL) {
            return attacker.getStat(Stat.SPECIAL_ATTACK);
        }
        int attack = attacker.getStat(Stat.ATTACK);
        if (attacker.hasStatus(StatusType.BURN)) {
            attack = attack / 2;
        }
        return attack;
    }

    public static int defenseStat(Combatant defender, Move move) {
        return move.getCategory() == MoveCategory.SPECIAL
            ? defender.getStat(Stat.SPECIAL_DEFENSE)
            : defender.getStat(Stat.DEFENSE);
    }

    /**
     * Full damage of a damaging move once the type multiplier and critical roll are known.
     */
    public static int calculate(Combatant attacker, Combatant defender, Move move,
                                double typeMultiplier, boolean critical) {
        if (!move.isDamaging()) {
            return 0;
        }
        double base = baseDamage(move.getPower(), attackStat(attacker, move), defenseStat(defender, move));
        return finalDamage(base, stab(attacker, move), typeMultiplier, critical ? CRITICAL_MULTIPLIER : 1.0);
    }

    /**
     * Damage a confused Pokemon deals to itself: same formula with attacker = defender,
     * power 40, Attack vs Defense, neutral type, no STAB, no critical hit.
     */
    public static int confusionSelfDamage(Combatant combatant) {
        double base = baseDamage(CONFUSION_SELF_HIT_POWER, combatant.getStat(Stat.ATTACK),
            combatant.getStat(Stat.DEFENSE));
        return finalDamage(base, 1.0, TypeChart.NEUTRAL, 1.0);
    }
}
