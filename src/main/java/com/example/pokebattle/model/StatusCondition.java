package com.example.pokebattle.model;

/**
 * The single status slot of a combatant. Immutable; transitions replace the value.
 * {@code turnsLeft} is only meaningful for SLEEP and CONFUSION and is 0 otherwise.
 */
public record StatusCondition(StatusType type, int turnsLeft) {

    public static final StatusCondition NONE = new StatusCondition(StatusType.NONE, 0);

    public StatusCondition {
        if (type == null) {
            throw new IllegalArgumentException("status type must not be null");
        }
        if (turnsLeft < 0) {
            throw new IllegalArgumentException("turnsLeft must be >= 0");
        }
        if (type != StatusType.SLEEP && type != StatusType.CONFUSION) {
            turnsLeft = 0;
        }
    }

    public static StatusCondition burn() { return new StatusCondition(StatusType.BURN, 0); }

    public static StatusCondition poison() { return new StatusCondition(StatusType.POISON, 0); }

    public static StatusCondition paralysis() { return new StatusCondition(StatusType.PARALYSIS, 0); }

    public static StatusCondition freeze() { return new StatusCondition(StatusType.FREEZE, 0); }

    public static StatusCondition sleep(int turns) { return new StatusCondition(StatusType.SLEEP, turns); }

    public static StatusCondition confusion(int turns) { return new StatusCondition(StatusType.CONFUSION, turns); }

    public boolean isNone() {
        return type == StatusType.NONE;
    }

    public boolean is(StatusType other) {
        return type == other;
    }

    /** Same status with one fewer turn remaining (never below 0). */
    public StatusCondition decrement() {
        return new StatusCondition(type, Math.max(0, turnsLeft - 1));
    }

    @Override
    public String toString() {
        if (type == StatusType.SLEEP || type == StatusType.CONFUSION) {
            return type.getKey() + "{" + turnsLeft + "}";
        }
        return type.getKey();
    }
}
