package com.example.pokebattle.combat;

import com.example.pokebattle.TestProfiles;
import com.example.pokebattle.error.InvalidArgumentException;
import com.example.pokebattle.model.PokemonType;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.ScriptedRandomSource;
import com.example.pokebattle.util.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BattleEngine Tests")
class BattleEngineTest {

    private final BattleEngine engine = new BattleEngine();

    @Test
    @DisplayName("Charizard outspeeds Pikachu and knocks it out on turn 1")
    void charizardActsFirst() {
        ScriptedRandomSource rng = ScriptedRandomSource.of(0.0, 0.5);

        BattleResult result = engine.simulate(TestProfiles.pikachu(), TestProfiles.charizard(), rng, true);

        assertEquals("Charizard", result.getWinner());
        assertEquals(1, result.getTotalTurns());
        assertEquals("Charizard won in 1 turns", result.getBattleSummary());
        assertEquals(List.of("Charizard used flamethrower and dealt 126 damage to Pikachu"),
            result.getTurns().get(0).actions());
        assertEquals(0, rng.remaining());
    }

    @Test
    @DisplayName("A knockout ends the turn before end-of-turn ticks")
    void knockoutHaltsTurn() {
        BattleState state = engine.start(TestProfiles.pikachu(), TestProfiles.charizard());
        Combatant charizard = state.getCombatant2();
        charizard.setStatus(StatusCondition.burn());

        TurnRecord record = engine.playTurn(state, ScriptedRandomSource.of(0.0, 0.5));

        assertEquals(1, record.actions().size());
        assertEquals(133, charizard.getCurrentHp());
        assertTrue(state.isResolved());
        assertSame(charizard, state.getWinner());
    }

    @Test
    @DisplayName("Sleep(2) skips two turns, the sleeper acts on the third")
    void sleepScenario() {
        BattleState state = engine.start(TestProfiles.normie("Alpha"), TestProfiles.normie("Beta"));
        state.getCombatant1().setStatus(StatusCondition.sleep(2));
        ScriptedRandomSource rng = ScriptedRandomSource.thenRepeat(0.5);

        TurnRecord t1 = engine.playTurn(state, rng);
        TurnRecord t2 = engine.playTurn(state, rng);
        TurnRecord t3 = engine.playTurn(state, rng);

        assertEquals(List.of("Alpha is fast asleep!", "Beta used tackle and dealt 29 damage to Alpha"), t1.actions());
        assertEquals(List.of("Alpha is fast asleep!", "Alpha woke up!", "Beta used tackle and dealt 29 damage to Alpha"),
            t2.actions());
        assertEquals("Alpha used tackle and dealt 29 damage to Beta", t3.actions().get(0));
        assertEquals(3, state.getTurn());
        assertEquals(BattlePhase.TURN_LOOP, state.getPhase());
    }

    @Test
    @DisplayName("Secondary status lands after the damage line")
    void secondaryStatusAppended() {
        BattleState state = engine.start(
            TestProfiles.withMoves("Zapper", List.of(PokemonType.ELECTRIC), List.of(TestProfiles.THUNDER_SHOCK)),
            TestProfiles.normie("Beta"));

        // Zapper: accuracy, crit, secondary. Beta: paralysis gate, accuracy, crit.
        TurnRecord record = engine.playTurn(state, ScriptedRandomSource.of(0.0, 0.5, 0.05, 0.9, 0.0, 0.5));

        assertEquals("Zapper used thunder-shock and dealt 29 damage to Beta Beta is now paralyzed!",
            record.actions().get(0));
        assertTrue(state.getCombatant2().hasStatus(StatusType.PARALYSIS));
        assertEquals(2, record.actions().size());
    }

    @Test
    @DisplayName("Same seed produces an identical battle")
    void seededBattlesRepeat() {
        BattleResult first = engine.simulate(TestProfiles.normie("Alpha"), TestProfiles.normie("Beta"),
            new SeededRandomSource(1234L), true);
        BattleResult second = engine.simulate(TestProfiles.normie("Alpha"), TestProfiles.normie("Beta"),
            new SeededRandomSource(1234L), true);

        assertEquals(first.toPayload(), second.toPayload());
        assertTrue(first.getTotalTurns() > 1);
    }

    @Test
    @DisplayName("Turn cap ends the battle in a draw")
    void turnCapDraw() {
        BattleEngine capped = new BattleEngine(5);
        ScriptedRandomSource rng = ScriptedRandomSource.of();

        BattleResult result = capped.simulate(TestProfiles.normie("Plain"), TestProfiles.phantom("Spook"), rng, true);

        assertNull(result.getWinner());
        assertTrue(result.isDraw());
        assertTrue(result.isTurnCapReached());
        assertEquals(5, result.getTotalTurns());
        assertEquals("Battle ended in a draw after reaching the 5-turn limit", result.getBattleSummary());
        assertEquals(List.of("Plain has no usable moves and struggles helplessly!",
            "Spook has no usable moves and struggles helplessly!"), result.getTurns().get(4).actions());
        assertEquals(0, rng.getDraws());
    }

    @Test
    @DisplayName("Both fainting from end-of-turn damage is a draw")
    void doubleKnockoutDraw() {
        BattleState state = engine.start(TestProfiles.normie("Plain"), TestProfiles.phantom("Spook"));
        for (Combatant c : List.of(state.getCombatant1(), state.getCombatant2())) {
            c.applyDamage(c.getMaxHp() - 1);
            c.setStatus(StatusCondition.burn());
        }

        TurnRecord record = engine.playTurn(state, ScriptedRandomSource.of());

        assertEquals("Plain is hurt by its burn! (-1 HP)", record.actions().get(2));
        assertEquals("Spook is hurt by its burn! (-1 HP)", record.actions().get(3));
        assertTrue(state.isResolved());
        assertTrue(state.isDraw());
        assertFalse(state.isTurnCapReached());
        assertEquals("Battle ended in a draw", BattleResult.from(state, engine.getMaxTurns(), false).getBattleSummary());
    }

    @Test
    @DisplayName("A combatant with no moves cannot attack")
    void noMoves() {
        BattleState state = engine.start(
            TestProfiles.withMoves("Empty", List.of(PokemonType.NORMAL), List.of()), TestProfiles.phantom("Spook"));

        TurnRecord record = engine.playTurn(state, ScriptedRandomSource.of());

        assertEquals("Empty has no moves and cannot attack!", record.actions().get(0));
    }

    @Test
    @DisplayName("Playing a resolved battle does nothing")
    void resolvedIsNoop() {
        BattleState state = engine.start(TestProfiles.pikachu(), TestProfiles.charizard());
        engine.playTurn(state, ScriptedRandomSource.of(0.0, 0.5));
        assertTrue(state.isResolved());

        assertNull(engine.playTurn(state, ScriptedRandomSource.of()));
        assertEquals(1, state.getTurn());
        assertEquals(1, state.getLog().size());
    }

    @Test
    @DisplayName("HP stays within bounds and every battle resolves")
    void hpBoundsAndResolution() {
        for (long seed = 0; seed < 25; seed++) {
            BattleState state = engine.start(TestProfiles.pikachu(), TestProfiles.normie("Beta"));
            SeededRandomSource rng = new SeededRandomSource(seed);
            while (!state.isResolved()) {
                engine.playTurn(state, rng);
                for (Combatant c : List.of(state.getCombatant1(), state.getCombatant2())) {
                    assertTrue(c.getCurrentHp() >= 0 && c.getCurrentHp() <= c.getMaxHp());
                }
            }
            assertTrue(state.getTurn() <= engine.getMaxTurns());
        }
    }

    @Test
    @DisplayName("Brief results omit the turn log but keep everything else")
    void briefPayload() {
        BattleResult detailed = engine.simulate(TestProfiles.pikachu(), TestProfiles.charizard(),
            ScriptedRandomSource.of(0.0, 0.5), true);
        BattleResult brief = engine.simulate(TestProfiles.pikachu(), TestProfiles.charizard(),
            ScriptedRandomSource.of(0.0, 0.5), false);

        Map<String, Object> full = detailed.toPayload();
        Map<String, Object> summary = brief.toPayload();

        assertTrue(full.containsKey("detailed_turns"));
        assertFalse(summary.containsKey("detailed_turns"));
        assertTrue(brief.getTurns().isEmpty());
        for (String key : List.of("pokemon1", "pokemon2", "winner", "total_turns", "battle_summary",
                "battle_mechanics", "status_effects_used")) {
            assertEquals(full.get(key), summary.get(key), key);
        }
        assertEquals("Pikachu", summary.get("pokemon1"));
        assertEquals(BattleResult.BATTLE_MECHANICS, summary.get("battle_mechanics"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Turn cap must be positive")
    void invalidCap(int cap) {
        assertThrows(InvalidArgumentException.class, () -> new BattleEngine(cap));
    }
}
