package com.example.pokebattle.combat;

import com.example.pokebattle.model.Move;

/**
 * Fixed move-choice heuristic. Uses no randomness, so the same combatants always
 * pick the same move.
 *
 * 1. The damaging move with the highest power * STAB * type multiplier * accuracy,
 *    earliest in the move list on ties.
 * 2. Otherwise the first status move with a secondary effect, while the opponent
 *    has no status.
 * 3. Otherwise nothing.
 */
public class MoveSelector {

    /**
     * @return the chosen move, or null if the attacker has nothing useful to do
     */
    public Move select(Combatant attacker, Combatant defender) {
        Move best = null;
        double bestScore = 0.0;
        for (Move move : attacker.getMoves()) {
            if (!move.isDamaging()) continue;
            double score = score(attacker, defender, move);
            if (score > bestScore) {
                best = move;
                bestScore = score;
            }
        }
        if (best != null) {
            return best;
        }

        if (!defender.hasStatus()) {
            for (Move move : attacker.getMoves()) {
                if (!move.isDamaging() && move.hasSecondaryEffect()) {
                    return move;
                }
            }
        }
        return null;
    }

    /**
     * Expected-damage score of a damaging move against this defender.
     */
    public double score(Combatant attacker, Combatant defender, Move move) {
        double typeMultiplier = TypeChart.effectiveness(move.getType(), defender.getTypes());
        return move.getPower()
            * DamageCalculator.stab(attacker, move)
            * typeMultiplier
            * (move.getAccuracy() / 100.0);
    }
}
