package com.example.pokebattle.combat;

import com.example.pokebattle.TestProfiles;
import com.example.pokebattle.error.DataIntegrityException;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.model.PokemonType;
import com.example.pokebattle.model.Stat;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatCalculator Tests")
class StatCalculatorTest {

    @ParameterizedTest
    @CsvSource({
        "35, 90",
        "1, 56",
        "78, 133",
        "160, 215",
        "255, 310"
    })
    @DisplayName("HP is base + level + 5 at level 50")
    void hpFormula(int base, int expected) {
        assertEquals(expected, StatCalculator.calculateHp(base));
        assertEquals((2 * base * 50) / 100 + 50 + 5, StatCalculator.calculateHp(base));
    }

    @ParameterizedTest
    @CsvSource({
        "55, 60",
        "5, 10",
        "109, 114",
        "0, 5"
    })
    @DisplayName("Other stats are base + 5 at level 50")
    void statFormula(int base, int expected) {
        assertEquals(expected, StatCalculator.calculateStat(base));
    }

    @Test
    @DisplayName("Derived combatant starts at full HP with no status")
    void deriveCombatant() {
        Combatant c = StatCalculator.deriveCombatant(TestProfiles.pikachu());
        assertEquals(90, c.getMaxHp());
        assertEquals(90, c.getCurrentHp());
        assertEquals(60, c.getStat(Stat.ATTACK));
        assertEquals(95, c.getStat(Stat.SPEED));
        assertFalse(c.hasStatus());
        assertEquals(StatusType.NONE, c.getStatus().type());
    }

    @Test
    @DisplayName("Missing base stat is a data integrity failure")
    void missingStat() {
        Map<Stat, Integer> stats = TestProfiles.stats(35, 55, 40, 50, 50, 90);
        stats.remove(Stat.SPEED);
        PokemonBaseProfile profile = new PokemonBaseProfile("Broken", stats, List.of(PokemonType.NORMAL), List.of());
        DataIntegrityException ex = assertThrows(DataIntegrityException.class,
            () -> StatCalculator.deriveCombatant(profile));
        assertTrue(ex.getMessage().contains("speed"));
    }

    @Test
    @DisplayName("Zero or three types are rejected")
    void typeCount() {
        PokemonBaseProfile none = new PokemonBaseProfile("Typeless", TestProfiles.stats(1, 1, 1, 1, 1, 1),
            List.of(), List.of());
        PokemonBaseProfile three = new PokemonBaseProfile("Triple", TestProfiles.stats(1, 1, 1, 1, 1, 1),
            List.of(PokemonType.FIRE, PokemonType.WATER, PokemonType.GRASS), List.of());
        assertThrows(DataIntegrityException.class, () -> StatCalculator.deriveCombatant(none));
        assertThrows(DataIntegrityException.class, () -> StatCalculator.deriveCombatant(three));
    }

    @Test
    @DisplayName("Damage clamps HP at zero and reports what was removed")
    void damageClamps() {
        Combatant c = StatCalculator.deriveCombatant(TestProfiles.pikachu());
        assertEquals(30, c.applyDamage(30));
        assertEquals(60, c.getCurrentHp());
        assertEquals(60, c.applyDamage(500));
        assertEquals(0, c.getCurrentHp());
        assertTrue(c.isFainted());
        assertEquals(0, c.applyDamage(10));
    }

    @Test
    @DisplayName("Paralysis halves speed for turn order only")
    void paralysisHalvesSpeed() {
        Combatant c = StatCalculator.deriveCombatant(TestProfiles.pikachu());
        c.setStatus(StatusCondition.paralysis());
        assertEquals(47, c.getEffectiveSpeed());
        assertEquals(95, c.getStat(Stat.SPEED));
    }
}
