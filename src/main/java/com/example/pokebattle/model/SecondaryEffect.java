package com.example.pokebattle.model;

/**
 * A chance to inflict a status on the target when the move connects.
 *
 * @param status the status inflicted (never NONE)
 * @param chancePercent probability in percent, 1-100
 */
public record SecondaryEffect(StatusType status, int chancePercent) {

    public SecondaryEffect {
        if (status == null || status == StatusType.NONE) {
            throw new IllegalArgumentException("secondary effect needs a real status");
        }
        if (chancePercent < 1 || chancePercent > 100) {
            throw new IllegalArgumentException("chancePercent out of range: " + chancePercent);
        }
    }

    public double probability() {
        return chancePercent / 100.0;
    }
}
