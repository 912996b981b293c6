package com.example.pokebattle.combat;

/**
 * Lifecycle of a single simulation.
 */
public enum BattlePhase {

    /** Combatants derived, no turn played yet */
    INIT,

    /** Turns are being played */
    TURN_LOOP,

    /** A side fainted, both fainted, or the turn cap was reached */
    RESOLVED
}
