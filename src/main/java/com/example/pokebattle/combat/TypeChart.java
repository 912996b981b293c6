package com.example.pokebattle.combat;

import com.example.pokebattle.error.DataIntegrityException;
import com.example.pokebattle.model.PokemonType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Gen 6+ type effectiveness chart covering all 18 x 18 ordered pairs.
 * Every cell starts neutral (1.0) and the static block overrides the
 * super-effective, resisted and immune cells, so the table is never partial.
 * Built once per JVM and never mutated afterwards.
 */
public final class TypeChart {

    public static final double IMMUNE = 0.0;
    public static final double NOT_VERY_EFFECTIVE = 0.5;
    public static final double NEUTRAL = 1.0;
    public static final double SUPER_EFFECTIVE = 2.0;

    private static final int SIZE = PokemonType.values().length;
    private static final double[][] CHART = new double[SIZE][SIZE];

    static {
        for (double[] row : CHART) {
            Arrays.fill(row, NEUTRAL);
        }

        nve("normal", "rock", "steel");
        imm("normal", "ghost");

        se("fire", "grass", "ice", "bug", "steel");
        nve("fire", "fire", "water", "rock", "dragon");

        se("water", "fire", "ground", "rock");
        nve("water", "water", "grass", "dragon");

        se("electric", "water", "flying");
        nve("electric", "electric", "grass", "dragon");
        imm("electric", "ground");

        se("grass", "water", "ground", "rock");
        nve("grass", "fire", "grass", "poison", "flying", "bug", "dragon", "steel");

        se("ice", "grass", "ground", "flying", "dragon");
        nve("ice", "fire", "water", "ice", "steel");

        se("fighting", "normal", "ice", "rock", "dark", "steel");
        nve("fighting", "poison", "flying", "psychic", "bug", "fairy");
        imm("fighting", "ghost");

        se("poison", "grass", "fairy");
        nve("poison", "poison", "ground", "rock", "ghost");
        imm("poison", "steel");

        se("ground", "fire", "electric", "poison", "rock", "steel");
        nve("ground", "grass", "bug");
        imm("ground", "flying");

        se("flying", "grass", "fighting", "bug");
        nve("flying", "electric", "rock", "steel");

        se("psychic", "fighting", "poison");
        nve("psychic", "psychic", "steel");
        imm("psychic", "dark");

        se("bug", "grass", "psychic", "dark");
        nve("bug", "fire", "fighting", "poison", "flying", "ghost", "steel", "fairy");

        se("rock", "fire", "ice", "flying", "bug");
        nve("rock", "fighting", "ground", "steel");

        se("ghost", "psychic", "ghost");
        nve("ghost", "dark");
        imm("ghost", "normal");

        se("dragon", "dragon");
        nve("dragon", "steel");
        imm("dragon", "fairy");

        se("dark", "psychic", "ghost");
        nve("dark", "fighting", "dark", "fairy");

        se("steel", "ice", "rock", "fairy");
        nve("steel", "fire", "water", "electric", "steel");

        se("fairy", "fighting", "dragon", "dark");
        nve("fairy", "fire", "poison", "steel");
    }

    private TypeChart() { }

    /**
     * Single-cell lookup.
     */
    public static double lookup(PokemonType attackType, PokemonType defendType) {
        if (attackType == null || defendType == null) {
            throw new DataIntegrityException("Type lookup with missing type");
        }
        return CHART[attackType.ordinal()][defendType.ordinal()];
    }

    /**
     * Combined multiplier of one attacking type against a one- or two-type defender,
     * e.g. Ground vs Fire/Flying = 2.0 * 0.0 = 0.0.
     *
     * @throws DataIntegrityException if the defender has no types or more than two
     */
    public static double effectiveness(PokemonType attackType, List<PokemonType> defendTypes) {
        if (defendTypes == null || defendTypes.isEmpty() || defendTypes.size() > 2) {
            throw new DataIntegrityException("Defender must have one or two types, got " + defendTypes);
        }
        double mult = NEUTRAL;
        for (PokemonType t : defendTypes) {
            mult *= lookup(attackType, t);
        }
        return mult;
    }

    /**
     * Token-based variant for callers holding raw reference-data strings.
     *
     * @throws DataIntegrityException for unknown type tokens
     */
    public static double effectiveness(String attackType, List<String> defendTypes) {
        if (defendTypes == null) {
            throw new DataIntegrityException("Defender types missing");
        }
        List<PokemonType> parsed = new ArrayList<>(defendTypes.size());
        for (String t : defendTypes) {
            parsed.add(PokemonType.fromString(t));
        }
        return effectiveness(PokemonType.fromString(attackType), parsed);
    }

    /**
     * Label for a combined multiplier as recorded in move outcomes.
     */
    public static String label(double multiplier) {
        if (multiplier == IMMUNE) return "no effect";
        if (multiplier < NEUTRAL) return "not very effective";
        if (multiplier > NEUTRAL) return "super effective";
        return "normal";
    }

    private static void se(String attacker, String... defenders) {
        set(SUPER_EFFECTIVE, attacker, defenders);
    }

    private static void nve(String attacker, String... defenders) {
        set(NOT_VERY_EFFECTIVE, attacker, defenders);
    }

    private static void imm(String attacker, String... defenders) {
        set(IMMUNE, attacker, defenders);
    }

    private static void set(double value, String attacker, String... defenders) {
        int row = PokemonType.fromString(attacker).ordinal();
        for (String d : defenders) {
            CHART[row][PokemonType.fromString(d).ordinal()] = value;
        }
    }
}
