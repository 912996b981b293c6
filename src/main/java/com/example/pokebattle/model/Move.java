package com.example.pokebattle.model;

import java.util.Objects;

/**
 * Immutable move definition as read from the reference data.
 */
public class Move {

    private final String name;
    private final PokemonType type;
    private final MoveCategory category;
    /** 0 for status-only moves */
    private final int power;
    /** 0-100 */
    private final int accuracy;
    /** null when the move has no secondary status effect */
    private final SecondaryEffect secondaryEffect;
    private final String shortEffect;

    public Move(String name, PokemonType type, MoveCategory category, int power, int accuracy,
                SecondaryEffect secondaryEffect, String shortEffect) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("move name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.category = Objects.requireNonNull(category, "category");
        this.power = category.dealsDamage() ? Math.max(0, power) : 0;
        this.accuracy = Math.max(0, Math.min(100, accuracy));
        this.secondaryEffect = secondaryEffect;
        this.shortEffect = shortEffect == null ? "" : shortEffect;
    }

    public Move(String name, PokemonType type, MoveCategory category, int power, int accuracy,
                SecondaryEffect secondaryEffect) {
        this(name, type, category, power, accuracy, secondaryEffect, "");
    }

    public Move(String name, PokemonType type, MoveCategory category, int power, int accuracy) {
        this(name, type, category, power, accuracy, null, "");
    }

    public String getName() { return name; }
    public PokemonType getType() { return type; }
    public MoveCategory getCategory() { return category; }
    public int getPower() { return power; }
    public int getAccuracy() { return accuracy; }
    public SecondaryEffect getSecondaryEffect() { return secondaryEffect; }
    public boolean hasSecondaryEffect() { return secondaryEffect != null; }
    public String getShortEffect() { return shortEffect; }

    /** True for physical/special moves with non-zero power. */
    public boolean isDamaging() {
        return category.dealsDamage() && power > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Move)) return false;
        return name.equalsIgnoreCase(((Move) o).name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase().hashCode();
    }

    @Override
    public String toString() {
        return String.format("Move[%s %s/%s power=%d acc=%d]", name, type.getKey(), category.getKey(), power, accuracy);
    }
}
