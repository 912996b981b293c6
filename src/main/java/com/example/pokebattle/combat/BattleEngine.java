package com.example.pokebattle.combat;

import com.example.pokebattle.effect.GateResult;
import com.example.pokebattle.effect.StatusRules;
import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a one-on-one battle to completion.
 *
 * Each turn: both sides commit a move, the scheduler orders them by effective Speed,
 * each actor passes its status gate and resolves its move. A knockout ends the turn
 * at once. Otherwise burn, poison and freeze tick for each standing combatant in
 * slot order. The battle resolves when a side faints or the turn cap is reached.
 *
 * The engine holds no per-battle state; every call works on its own {@link BattleState}.
 */
public class BattleEngine {

    private static final Logger logger = LoggerFactory.getLogger(BattleEngine.class);

    public static final int DEFAULT_MAX_TURNS = 100;

    private final int maxTurns;
    private final MoveSelector moveSelector;
    private final TurnScheduler turnScheduler;
    private final MoveResolver moveResolver;

    public BattleEngine() {
        this(DEFAULT_MAX_TURNS);
    }

    public BattleEngine(int maxTurns) {
        this(maxTurns, new MoveSelector(), new TurnScheduler(), new MoveResolver());
    }

    public BattleEngine(int maxTurns, MoveSelector moveSelector, TurnScheduler turnScheduler,
                        MoveResolver moveResolver) {
        if (maxTurns < 1) {
            throw new InvalidArgumentException("maxTurns must be at least 1, got " + maxTurns);
        }
        this.maxTurns = maxTurns;
        this.moveSelector = moveSelector;
        this.turnScheduler = turnScheduler;
        this.moveResolver = moveResolver;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    /**
     * Derive both combatants and open a fresh battle.
     */
    public BattleState start(PokemonBaseProfile profile1, PokemonBaseProfile profile2) {
        Combatant c1 = StatCalculator.deriveCombatant(profile1);
        Combatant c2 = StatCalculator.deriveCombatant(profile2);
        logger.info("[BattleEngine] Starting battle {} (HP {}) vs {} (HP {})",
            c1.getName(), c1.getMaxHp(), c2.getName(), c2.getMaxHp());
        return new BattleState(c1, c2);
    }

    /**
     * Simulate a full battle with the given randomness.
     */
    public BattleResult simulate(PokemonBaseProfile profile1, PokemonBaseProfile profile2, RandomSource rng,
                                 boolean detailed) {
        BattleState state = start(profile1, profile2);
        while (!state.isResolved()) {
            playTurn(state, rng);
        }
        BattleResult result = BattleResult.from(state, maxTurns, detailed);
        logger.info("[BattleEngine] {}", result.getBattleSummary());
        return result;
    }

    /**
     * Play one turn. No-op on a resolved battle.
     *
     * @return the record appended to the log, or null if the battle was already over
     */
    public TurnRecord playTurn(BattleState state, RandomSource rng) {
        if (state.isResolved()) {
            return null;
        }
        state.setPhase(BattlePhase.TURN_LOOP);
        int turn = state.nextTurn();
        List<String> actions = new ArrayList<>();

        Combatant c1 = state.getCombatant1();
        Combatant c2 = state.getCombatant2();
        Move move1 = moveSelector.select(c1, c2);
        Move move2 = moveSelector.select(c2, c1);

        TurnScheduler.TurnOrder order = turnScheduler.orderActions(c1, c2);
        Combatant first = order.first();
        Combatant second = order.second();

        act(first, second, first == c1 ? move1 : move2, rng, actions);
        if (!state.anyFainted()) {
            act(second, first, second == c1 ? move1 : move2, rng, actions);
        }

        if (!state.anyFainted()) {
            addIfPresent(actions, StatusRules.endOfTurn(c1, rng));
            addIfPresent(actions, StatusRules.endOfTurn(c2, rng));
        }

        TurnRecord record = new TurnRecord(turn, actions);
        state.addTurn(record);
        if (logger.isDebugEnabled()) {
            logger.debug("[BattleEngine] Turn {}: {} ({}/{}) {} ({}/{})", turn,
                c1.getName(), c1.getCurrentHp(), c1.getMaxHp(),
                c2.getName(), c2.getCurrentHp(), c2.getMaxHp());
        }

        resolve(state);
        return record;
    }

    private void act(Combatant actor, Combatant target, Move move, RandomSource rng, List<String> actions) {
        GateResult gate = StatusRules.beforeAction(actor, rng);
        actions.addAll(gate.messages());
        if (!gate.canAct() || actor.isFainted()) {
            return;
        }

        if (move == null) {
            if (actor.getMoves().isEmpty()) {
                actions.add(actor.getName() + " has no moves and cannot attack!");
            } else {
                actions.add(actor.getName() + " has no usable moves and struggles helplessly!");
            }
            return;
        }

        MoveOutcome outcome = moveResolver.resolveMove(actor, target, move, rng);
        String line = outcome.describe();
        if (outcome.getStatusInflicted() != null) {
            String inflicted = StatusRules.inflict(target, outcome.getStatusInflicted(), rng);
            if (inflicted != null) {
                line = line + " " + inflicted;
            }
        }
        actions.add(line);
    }

    private void resolve(BattleState state) {
        boolean down1 = state.getCombatant1().isFainted();
        boolean down2 = state.getCombatant2().isFainted();
        if (down1 && down2) {
            state.resolveDraw(false);
        } else if (down1) {
            state.resolveWinner(state.getCombatant2());
        } else if (down2) {
            state.resolveWinner(state.getCombatant1());
        } else if (state.getTurn() >= maxTurns) {
            state.resolveDraw(true);
        }
    }

    private static void addIfPresent(List<String> actions, String line) {
        if (line != null) {
            actions.add(line);
        }
    }
}
