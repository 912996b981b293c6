package com.example.pokebattle.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Species data the battle engine reads: base stats, one or two types and an ordered
 * move list. Completeness is checked when a combatant is derived from it, not here,
 * so that incomplete rows from storage surface as data-integrity errors at battle time.
 */
public class PokemonBaseProfile {

    private final String name;
    private final Map<Stat, Integer> baseStats;
    private final List<PokemonType> types;
    private final List<Move> moves;

    public PokemonBaseProfile(String name, Map<Stat, Integer> baseStats, List<PokemonType> types, List<Move> moves) {
        this.name = name;
        EnumMap<Stat, Integer> stats = new EnumMap<>(Stat.class);
        if (baseStats != null) stats.putAll(baseStats);
        this.baseStats = Collections.unmodifiableMap(stats);
        this.types = types == null ? List.of() : List.copyOf(types);
        this.moves = moves == null ? List.of() : List.copyOf(moves);
    }

    public String getName() { return name; }
    public Map<Stat, Integer> getBaseStats() { return baseStats; }
    public List<PokemonType> getTypes() { return types; }
    public List<Move> getMoves() { return moves; }

    /** @return the base stat, or null if the profile does not carry it */
    public Integer getBaseStat(Stat stat) {
        return baseStats.get(stat);
    }

    public boolean hasType(PokemonType type) {
        return types.contains(type);
    }

    @Override
    public String toString() {
        return "PokemonBaseProfile[" + name + " " + types + " " + baseStats + "]";
    }
}
