package com.example.pokebattle.combat;

import com.example.pokebattle.model.Move;
import com.example.pokebattle.model.PokemonBaseProfile;
import com.example.pokebattle.model.PokemonType;
import com.example.pokebattle.model.Stat;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps a Pokemon participating in one battle.
 * Holds the derived level-50 stats, current HP and the single status slot.
 * Created at battle start, mutated every turn, discarded when the battle ends.
 */
public class Combatant {

    /** Reference data this combatant was derived from */
    private final PokemonBaseProfile profile;

    /** Level-50 stats, computed once */
    private final Map<Stat, Integer> stats;

    /** Current HP, always within [0, maxHp] */
    private int currentHp;

    /** The one status slot */
    private StatusCondition status = StatusCondition.NONE;

    Combatant(PokemonBaseProfile profile, Map<Stat, Integer> stats) {
        this.profile = profile;
        this.stats = Collections.unmodifiableMap(new EnumMap<>(stats));
        this.currentHp = this.stats.get(Stat.HP);
    }

    // Identification

    public String getName() { return profile.getName(); }

    public PokemonBaseProfile getProfile() { return profile; }

    public List<PokemonType> getTypes() { return profile.getTypes(); }

    public List<Move> getMoves() { return profile.getMoves(); }

    public boolean hasType(PokemonType type) { return profile.hasType(type); }

    // Stats

    public int getStat(Stat stat) { return stats.get(stat); }

    public Map<Stat, Integer> getStats() { return stats; }

    public int getMaxHp() { return stats.get(Stat.HP); }

    /**
     * Speed used for turn order only. Paralysis halves it; the stored stat is untouched.
     */
    public int getEffectiveSpeed() {
        int speed = stats.get(Stat.SPEED);
        return status.is(StatusType.PARALYSIS) ? speed / 2 : speed;
    }

    // Health

    public int getCurrentHp() { return currentHp; }

    public boolean isFainted() { return currentHp <= 0; }

    public boolean isAlive() { return currentHp > 0; }

    /**
     * Apply damage, clamping HP at 0.
     *
     * @return the HP actually removed
     */
    public int applyDamage(int amount) {
        if (amount <= 0) return 0;
        int before = currentHp;
        currentHp = Math.max(0, currentHp - amount);
        return before - currentHp;
    }

    // Status

    public StatusCondition getStatus() { return status; }

    public boolean hasStatus() { return !status.isNone(); }

    public boolean hasStatus(StatusType type) { return status.is(type); }

    /**
     * Replace the status slot. Only the status rules call this.
     */
    public void setStatus(StatusCondition status) {
        this.status = status == null ? StatusCondition.NONE : status;
    }

    public void clearStatus() {
        this.status = StatusCondition.NONE;
    }

    @Override
    public String toString() {
        return String.format("Combatant[%s hp=%d/%d status=%s]", getName(), currentHp, getMaxHp(), status);
    }
}
