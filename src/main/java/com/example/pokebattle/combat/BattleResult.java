package com.example.pokebattle.combat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of a simulation as handed to callers. The per-turn log is only
 * included when the caller asked for a detailed result.
 */
public class BattleResult {

    /** Mechanics the engine models, reported with every result */
    public static final List<String> BATTLE_MECHANICS = List.of(
        "Type effectiveness calculations",
        "Damage formulas based on stats and move power",
        "Speed-based turn order",
        "Status effects: Burn, Poison, Paralysis, Sleep, Freeze, Confusion",
        "Critical hits and STAB bonuses",
        "Level 50 stat scaling"
    );

    private final String pokemon1;
    private final String pokemon2;
    private final String winner;
    private final boolean draw;
    private final boolean turnCapReached;
    private final int totalTurns;
    private final String battleSummary;
    private final List<TurnRecord> turns;
    private final boolean detailed;

    public BattleResult(String pokemon1, String pokemon2, String winner, boolean draw, boolean turnCapReached,
                        int totalTurns, String battleSummary, List<TurnRecord> turns, boolean detailed) {
        this.pokemon1 = pokemon1;
        this.pokemon2 = pokemon2;
        this.winner = winner;
        this.draw = draw;
        this.turnCapReached = turnCapReached;
        this.totalTurns = totalTurns;
        this.battleSummary = battleSummary;
        this.turns = detailed && turns != null ? List.copyOf(turns) : List.of();
        this.detailed = detailed;
    }

    public static BattleResult from(BattleState state, int maxTurns, boolean detailed) {
        String winnerName = state.getWinner() != null ? state.getWinner().getName() : null;
        String summary;
        if (winnerName != null) {
            summary = winnerName + " won in " + state.getTurn() + " turns";
        } else if (state.isTurnCapReached()) {
            summary = "Battle ended in a draw after reaching the " + maxTurns + "-turn limit";
        } else {
            summary = "Battle ended in a draw";
        }
        return new BattleResult(state.getCombatant1().getName(), state.getCombatant2().getName(), winnerName,
            state.isDraw(), state.isTurnCapReached(), state.getTurn(), summary, state.getLog(), detailed);
    }

    public String getPokemon1() { return pokemon1; }
    public String getPokemon2() { return pokemon2; }
    /** @return the winner's name, or null on a draw */
    public String getWinner() { return winner; }
    public boolean isDraw() { return draw; }
    public boolean isTurnCapReached() { return turnCapReached; }
    public int getTotalTurns() { return totalTurns; }
    public String getBattleSummary() { return battleSummary; }
    /** Empty unless detailed */
    public List<TurnRecord> getTurns() { return turns; }
    public boolean isDetailed() { return detailed; }

    /**
     * Structured form for the tool surface. {@code detailed_turns} is present only
     * for detailed results.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("pokemon1", pokemon1);
        out.put("pokemon2", pokemon2);
        out.put("winner", winner);
        out.put("total_turns", totalTurns);
        out.put("battle_summary", battleSummary);
        out.put("status_effects_used", true);
        out.put("battle_mechanics", BATTLE_MECHANICS);
        if (detailed) {
            List<Map<String, Object>> rows = new ArrayList<>(turns.size());
            for (TurnRecord t : turns) rows.add(t.toPayload());
            out.put("detailed_turns", rows);
        }
        return out;
    }

    @Override
    public String toString() {
        return String.format("BattleResult[%s vs %s: %s]", pokemon1, pokemon2, battleSummary);
    }
}
