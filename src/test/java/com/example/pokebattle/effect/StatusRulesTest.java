package com.example.pokebattle.effect;

import com.example.pokebattle.TestProfiles;
import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.combat.StatCalculator;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.ScriptedRandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusRules Tests")
class StatusRulesTest {

    private Combatant pikachu;

    @BeforeEach
    void setUp() {
        pikachu = StatCalculator.deriveCombatant(TestProfiles.pikachu());
    }

    @ParameterizedTest
    @EnumSource(value = StatusType.class, names = "NONE", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Every status has a registered handler")
    void handlersRegistered(StatusType type) {
        assertNotNull(StatusRules.getHandler(type));
        assertEquals(type, StatusRules.getHandler(type).getType());
    }

    @Test
    @DisplayName("Inflicting fills the slot and reports it")
    void inflictFillsSlot() {
        String line = StatusRules.inflict(pikachu, StatusType.BURN, ScriptedRandomSource.of());
        assertEquals("Pikachu is now burned!", line);
        assertTrue(pikachu.hasStatus(StatusType.BURN));
    }

    @Test
    @DisplayName("A second status never replaces the first")
    void atMostOneStatus() {
        pikachu.setStatus(StatusCondition.paralysis());
        assertNull(StatusRules.inflict(pikachu, StatusType.POISON, ScriptedRandomSource.of()));
        assertTrue(pikachu.hasStatus(StatusType.PARALYSIS));
    }

    @Test
    @DisplayName("Fainted combatants cannot receive a status")
    void faintedCannotBeInflicted() {
        pikachu.applyDamage(1000);
        assertFalse(StatusRules.canInflict(pikachu));
        assertNull(StatusRules.inflict(pikachu, StatusType.BURN, ScriptedRandomSource.of()));
        assertFalse(pikachu.hasStatus());
    }

    @ParameterizedTest
    @CsvSource({
        "0.0, 1",
        "0.34, 2",
        "0.5, 2",
        "0.99, 3"
    })
    @DisplayName("Sleep lasts one to three turns, drawn once")
    void sleepDuration(double draw, int expectedTurns) {
        ScriptedRandomSource rng = ScriptedRandomSource.of(draw);
        assertEquals("Pikachu is now asleep!", StatusRules.inflict(pikachu, StatusType.SLEEP, rng));
        assertEquals(expectedTurns, pikachu.getStatus().turnsLeft());
        assertEquals(1, rng.getDraws());
    }

    @ParameterizedTest
    @CsvSource({
        "0.0, 2",
        "0.5, 4",
        "0.99, 5"
    })
    @DisplayName("Confusion lasts two to five turns")
    void confusionDuration(double draw, int expectedTurns) {
        StatusRules.inflict(pikachu, StatusType.CONFUSION, ScriptedRandomSource.of(draw));
        assertEquals(expectedTurns, pikachu.getStatus().turnsLeft());
    }

    @Test
    @DisplayName("Sleep(2) skips exactly two turns, then the combatant acts")
    void sleepTwoSkipsTwoTurns() {
        pikachu.setStatus(StatusCondition.sleep(2));
        ScriptedRandomSource rng = ScriptedRandomSource.of();

        GateResult first = StatusRules.beforeAction(pikachu, rng);
        assertFalse(first.canAct());
        assertEquals(List.of("Pikachu is fast asleep!"), first.messages());
        assertEquals(1, pikachu.getStatus().turnsLeft());

        GateResult second = StatusRules.beforeAction(pikachu, rng);
        assertFalse(second.canAct());
        assertEquals(List.of("Pikachu is fast asleep!", "Pikachu woke up!"), second.messages());
        assertFalse(pikachu.hasStatus());

        assertTrue(StatusRules.beforeAction(pikachu, rng).canAct());
        assertEquals(0, rng.getDraws());
    }

    @ParameterizedTest
    @CsvSource({
        "0.1, false",
        "0.24, false",
        "0.25, true",
        "0.9, true"
    })
    @DisplayName("Paralysis stops the combatant 25% of the time")
    void paralysisGate(double draw, boolean canAct) {
        pikachu.setStatus(StatusCondition.paralysis());
        GateResult gate = StatusRules.beforeAction(pikachu, ScriptedRandomSource.of(draw));
        assertEquals(canAct, gate.canAct());
        if (!canAct) {
            assertEquals(List.of("Pikachu is fully paralyzed! It can't move!"), gate.messages());
        }
        assertTrue(pikachu.hasStatus(StatusType.PARALYSIS));
    }

    @Test
    @DisplayName("Frozen combatants never act and thaw 20% of the time at end of turn")
    void freeze() {
        pikachu.setStatus(StatusCondition.freeze());

        GateResult gate = StatusRules.beforeAction(pikachu, ScriptedRandomSource.of());
        assertFalse(gate.canAct());
        assertEquals(List.of("Pikachu is frozen solid!"), gate.messages());

        assertNull(StatusRules.endOfTurn(pikachu, ScriptedRandomSource.of(0.5)));
        assertTrue(pikachu.hasStatus(StatusType.FREEZE));

        assertEquals("Pikachu thawed out!", StatusRules.endOfTurn(pikachu, ScriptedRandomSource.of(0.1)));
        assertFalse(pikachu.hasStatus());
    }

    @Test
    @DisplayName("Confused combatant may hit itself, then snaps out when the counter runs out")
    void confusion() {
        pikachu.setStatus(StatusCondition.confusion(2));

        GateResult selfHit = StatusRules.beforeAction(pikachu, ScriptedRandomSource.of(0.4));
        assertFalse(selfHit.canAct());
        assertEquals(List.of("Pikachu is confused!", "Pikachu hurt itself in its confusion! (-25 HP)"),
            selfHit.messages());
        assertEquals(65, pikachu.getCurrentHp());
        assertEquals(1, pikachu.getStatus().turnsLeft());

        GateResult acts = StatusRules.beforeAction(pikachu, ScriptedRandomSource.of(0.6));
        assertTrue(acts.canAct());
        assertEquals(List.of("Pikachu is confused!", "Pikachu snapped out of confusion!"), acts.messages());
        assertFalse(pikachu.hasStatus());
    }

    @Test
    @DisplayName("Burn and poison tick a fraction of max HP each turn")
    void damageOverTime() {
        pikachu.setStatus(StatusCondition.burn());
        assertEquals("Pikachu is hurt by its burn! (-5 HP)", StatusRules.endOfTurn(pikachu, ScriptedRandomSource.of()));
        assertEquals(85, pikachu.getCurrentHp());

        Combatant other = StatCalculator.deriveCombatant(TestProfiles.pikachu());
        other.setStatus(StatusCondition.poison());
        assertEquals("Pikachu is hurt by poison! (-11 HP)", StatusRules.endOfTurn(other, ScriptedRandomSource.of()));
        assertEquals(79, other.getCurrentHp());
    }

    @Test
    @DisplayName("Damage-over-time ticks for at least 1 HP and report only what was removed")
    void tickMinimumAndClamp() {
        DotStatus tiny = new DotStatus(StatusType.POISON, 1000, "poison");
        assertEquals(1, tiny.tickDamage(pikachu));

        pikachu.applyDamage(88);
        pikachu.setStatus(StatusCondition.poison());
        assertEquals("Pikachu is hurt by poison! (-2 HP)", StatusRules.endOfTurn(pikachu, ScriptedRandomSource.of()));
        assertTrue(pikachu.isFainted());
    }

    @Test
    @DisplayName("Healthy combatants pass the gate with no messages")
    void healthyProceeds() {
        GateResult gate = StatusRules.beforeAction(pikachu, ScriptedRandomSource.of());
        assertTrue(gate.canAct());
        assertTrue(gate.messages().isEmpty());
        assertNull(StatusRules.endOfTurn(pikachu, ScriptedRandomSource.of()));
    }
}
