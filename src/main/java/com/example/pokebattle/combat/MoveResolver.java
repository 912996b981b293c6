package com.example.pokebattle.combat;

import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.SecondaryEffect;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;

/**
 * Resolves one move from attacker to defender: accuracy, damage, critical hit and the
 * secondary status roll. Mutates only the defender's HP; status slots are left to the
 * status rules.
 *
 * Draw order: accuracy, then critical hit (damaging moves), then the secondary chance
 * (only when the defender could receive a status).
 */
public class MoveResolver {

    public MoveOutcome resolveMove(Combatant attacker, Combatant defender, Move move, RandomSource rng) {
        double accuracyRoll = rng.nextDouble() * 100.0;
        if (accuracyRoll >= move.getAccuracy()) {
            return MoveOutcome.miss(attacker, defender, move);
        }

        if (!move.isDamaging()) {
            StatusType inflicted = rollSecondary(defender, move, TypeChart.NEUTRAL, rng);
            return MoveOutcome.statusMove(attacker, defender, move, inflicted);
        }

        double typeMultiplier = TypeChart.effectiveness(move.getType(), defender.getTypes());
        boolean critical = rng.chance(DamageCalculator.CRITICAL_CHANCE);
        int damage = DamageCalculator.calculate(attacker, defender, move, typeMultiplier, critical);
        defender.applyDamage(damage);

        StatusType inflicted = rollSecondary(defender, move, typeMultiplier, rng);
        return MoveOutcome.hit(attacker, defender, move, damage, typeMultiplier,
            critical && typeMultiplier != TypeChart.IMMUNE, inflicted);
    }

    private StatusType rollSecondary(Combatant defender, Move move, double typeMultiplier, RandomSource rng) {
        SecondaryEffect effect = move.getSecondaryEffect();
        if (effect == null) return null;
        // an afflicted, fainted or immune defender is not even rolled for
        if (defender.hasStatus() || defender.isFainted() || typeMultiplier == TypeChart.IMMUNE) {
            return null;
        }
        return rng.chance(effect.probability()) ? effect.status() : null;
    }
}
