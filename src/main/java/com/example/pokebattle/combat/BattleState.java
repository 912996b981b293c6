package com.example.pokebattle.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one simulation: both combatants, the turn counter, the log and
 * the outcome. Owned by a single engine call and never shared.
 */
public class BattleState {

    private final Combatant combatant1;
    private final Combatant combatant2;

    private BattlePhase phase = BattlePhase.INIT;

    /** Turns started so far; 0 before the first turn */
    private int turn = 0;

    private final List<TurnRecord> log = new ArrayList<>();

    /** Null while running and on a draw */
    private Combatant winner;

    private boolean draw;

    private boolean turnCapReached;

    public BattleState(Combatant combatant1, Combatant combatant2) {
        this.combatant1 = combatant1;
        this.combatant2 = combatant2;
    }

    public Combatant getCombatant1() { return combatant1; }

    public Combatant getCombatant2() { return combatant2; }

    public BattlePhase getPhase() { return phase; }

    public void setPhase(BattlePhase phase) { this.phase = phase; }

    public boolean isResolved() { return phase == BattlePhase.RESOLVED; }

    public int getTurn() { return turn; }

    int nextTurn() {
        return ++turn;
    }

    public List<TurnRecord> getLog() {
        return Collections.unmodifiableList(log);
    }

    void addTurn(TurnRecord record) {
        log.add(record);
    }

    public Combatant getWinner() { return winner; }

    public boolean isDraw() { return draw; }

    public boolean isTurnCapReached() { return turnCapReached; }

    void resolveWinner(Combatant winner) {
        this.winner = winner;
        this.draw = false;
        this.phase = BattlePhase.RESOLVED;
    }

    void resolveDraw(boolean turnCapReached) {
        this.winner = null;
        this.draw = true;
        this.turnCapReached = turnCapReached;
        this.phase = BattlePhase.RESOLVED;
    }

    /** True once either side is down. */
    public boolean anyFainted() {
        return combatant1.isFainted() || combatant2.isFainted();
    }
}
