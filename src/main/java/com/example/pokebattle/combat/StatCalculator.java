package com.example.pokebattle.combat;

import com.example.pokebattle.error.DataIntegrityException;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.model.Stat;

import java.util.EnumMap;
import java.util.Map;

/**
 * Level-50 stat derivation.
 *
 * Non-HP stat: floor((2 * base * 50) / 100) + 5
 * HP:          floor((2 * base * 50) / 100) + 50 + 5
 *
 * No IVs, EVs or natures; every combatant fights at level 50.
 */
public final class StatCalculator {

    public static final int LEVEL = 50;

    private StatCalculator() { }

    public static int calculateStat(int base) {
        return (2 * base * LEVEL) / 100 + 5;
    }

    public static int calculateHp(int base) {
        return (2 * base * LEVEL) / 100 + LEVEL + 5;
    }

    /**
     * Derive all six working stats from a profile.
     *
     * @throws DataIntegrityException if any of the six base stats is missing or negative
     */
    public static Map<Stat, Integer> deriveStats(PokemonBaseProfile profile) {
        Map<Stat, Integer> derived = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            Integer base = profile.getBaseStat(stat);
            if (base == null) {
                throw new DataIntegrityException("Pokemon " + profile.getName() + " is missing base stat " + stat.getKey());
            }
            if (base < 0) {
                throw new DataIntegrityException("Pokemon " + profile.getName() + " has negative base stat " + stat.getKey());
            }
            derived.put(stat, stat == Stat.HP ? calculateHp(base) : calculateStat(base));
        }
        return derived;
    }

    /**
     * Build a fresh battle-scoped combatant: derived stats, full HP, no status.
     *
     * @throws DataIntegrityException for missing stats or a type list that is empty or longer than two
     */
    public static Combatant deriveCombatant(PokemonBaseProfile profile) {
        if (profile == null) {
            throw new DataIntegrityException("Profile is missing");
        }
        if (profile.getName() == null || profile.getName().isBlank()) {
            throw new DataIntegrityException("Profile has no name");
        }
        int typeCount = profile.getTypes().size();
        if (typeCount < 1 || typeCount > 2) {
            throw new DataIntegrityException("Pokemon " + profile.getName() + " must have one or two types, has " + typeCount);
        }
        return new Combatant(profile, deriveStats(profile));
    }
}
