package com.example.pokebattle.combat;

import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.StatusType;

/**
 * Result of resolving one move. Carries everything the battle log needs.
 * A reported status has not been applied yet; the engine hands it to the status rules.
 */
public class MoveOutcome {

    public enum ResultType {
        HIT,            // Damaging move connected
        CRITICAL_HIT,   // Damaging move connected with a critical hit
        NO_EFFECT,      // Damaging move connected but the defender is immune
        STATUS_MOVE,    // Status-category move connected
        MISS            // Accuracy roll failed
    }

    private final ResultType type;
    private final String attackerName;
    private final String defenderName;
    private final Move move;
    private final int damage;
    private final double typeMultiplier;
    private final StatusType statusInflicted;

    private MoveOutcome(ResultType type, String attackerName, String defenderName, Move move,
                        int damage, double typeMultiplier, StatusType statusInflicted) {
        this.type = type;
        this.attackerName = attackerName;
        this.defenderName = defenderName;
        this.move = move;
        this.damage = damage;
        this.typeMultiplier = typeMultiplier;
        this.statusInflicted = statusInflicted;
    }

    // Static factory methods

    public static MoveOutcome miss(Combatant attacker, Combatant defender, Move move) {
        return new MoveOutcome(ResultType.MISS, attacker.getName(), defender.getName(), move, 0, TypeChart.NEUTRAL, null);
    }

    public static MoveOutcome hit(Combatant attacker, Combatant defender, Move move, int damage,
                                  double typeMultiplier, boolean critical, StatusType statusInflicted) {
        ResultType t;
        if (typeMultiplier == TypeChart.IMMUNE) {
            t = ResultType.NO_EFFECT;
        } else {
            t = critical ? ResultType.CRITICAL_HIT : ResultType.HIT;
        }
        return new MoveOutcome(t, attacker.getName(), defender.getName(), move, damage, typeMultiplier, statusInflicted);
    }

    public static MoveOutcome statusMove(Combatant attacker, Combatant defender, Move move, StatusType statusInflicted) {
        return new MoveOutcome(ResultType.STATUS_MOVE, attacker.getName(), defender.getName(), move, 0,
            TypeChart.NEUTRAL, statusInflicted);
    }

    // Getters

    public ResultType getType() { return type; }
    public Move getMove() { return move; }
    public int getDamage() { return damage; }
    public double getTypeMultiplier() { return typeMultiplier; }
    public StatusType getStatusInflicted() { return statusInflicted; }
    public String getAttackerName() { return attackerName; }
    public String getDefenderName() { return defenderName; }

    public boolean isHit() { return type != ResultType.MISS; }
    public boolean isCritical() { return type == ResultType.CRITICAL_HIT; }
    public boolean isMiss() { return type == ResultType.MISS; }

    public String getEffectivenessLabel() {
        return TypeChart.label(typeMultiplier);
    }

    /**
     * Log line for this action, without the status-application suffix.
     */
    public String describe() {
        String moveName = move.getName();
        switch (type) {
            case MISS:
                return attackerName + " used " + moveName + " but it missed!";
            case NO_EFFECT:
                return attackerName + " used " + moveName + ", but it doesn't affect " + defenderName + "!";
            case STATUS_MOVE:
                return statusInflicted != null
                    ? attackerName + " used " + moveName + "!"
                    : attackerName + " used " + moveName + ", but it had no effect on " + defenderName + "!";
            default:
                StringBuilder sb = new StringBuilder();
                sb.append(attackerName).append(" used ").append(moveName)
                  .append(" and dealt ").append(damage).append(" damage to ").append(defenderName);
                if (isCritical()) {
                    sb.append(" (Critical hit!)");
                }
                if (typeMultiplier > TypeChart.NEUTRAL) {
                    sb.append(" It's super effective!");
                } else if (typeMultiplier < TypeChart.NEUTRAL) {
                    sb.append(" It's not very effective...");
                }
                return sb.toString();
        }
    }

    @Override
    public String toString() {
        return String.format("MoveOutcome[%s %s -> %s with %s, damage=%d, x%.2f, status=%s]",
            type, attackerName, defenderName, move.getName(), damage, typeMultiplier, statusInflicted);
    }
}
