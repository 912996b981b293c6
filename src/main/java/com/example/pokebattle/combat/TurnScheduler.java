package com.example.pokebattle.combat;

/**
 * Orders the two actions of a turn by effective Speed (paralysis halves it).
 *
 * Tie rule: on exactly equal effective Speed the first argument, the combatant in
 * slot 1 of the battle, acts first. This keeps seeded logs reproducible.
 */
public class TurnScheduler {

    /** The two combatants in acting order. */
    public record TurnOrder(Combatant first, Combatant second) { }

    public TurnOrder orderActions(Combatant a, Combatant b) {
        if (b.getEffectiveSpeed() > a.getEffectiveSpeed()) {
            return new TurnOrder(b, a);
        }
        return new TurnOrder(a, b);
    }
}
