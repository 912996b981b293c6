package com.example.pokebattle.effect;

import com.example.pokebattle.combat.Combatant;
import com.example.pokebattle.model.StatusCondition;
import com.example.pokebattle.model.StatusType;
import com.example.pokebattle.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of status handlers and the single entry point the battle engine uses to
 * inflict statuses, gate actions and run end-of-turn ticks.
 * Populated once in the static block and read-only afterwards.
 */
public final class StatusRules {

    private static final Logger logger = LoggerFactory.getLogger(StatusRules.class);

    private static final Map<StatusType, StatusHandler> HANDLERS;

    static {
        Map<StatusType, StatusHandler> h = new EnumMap<>(StatusType.class);
        register(h, DotStatus.burn());
        register(h, DotStatus.poison());
        register(h, new ParalyzedStatus());
        register(h, new SleepStatus());
        register(h, new FrozenStatus());
        register(h, new ConfusedStatus());
        HANDLERS = Collections.unmodifiableMap(h);
    }

    private StatusRules() { }

    private static void register(Map<StatusType, StatusHandler> map, StatusHandler handler) {
        map.put(handler.getType(), handler);
    }

    public static StatusHandler getHandler(StatusType type) {
        return HANDLERS.get(type);
    }

    /**
     * A status can only land on a standing combatant with an empty slot.
     */
    public static boolean canInflict(Combatant target) {
        return target.isAlive() && !target.hasStatus();
    }

    /**
     * Place a status in the target's slot.
     *
     * @return the log line ("Pikachu is now paralyzed!"), or null if the slot was taken
     */
    public static String inflict(Combatant target, StatusType type, RandomSource rng) {
        StatusHandler handler = HANDLERS.get(type);
        if (handler == null || !canInflict(target)) {
            return null;
        }
        StatusCondition condition = handler.create(rng);
        target.setStatus(condition);
        logger.debug("[StatusRules] {} is now {}", target.getName(), condition);
        return target.getName() + " is now " + type.getAdjective() + "!";
    }

    /**
     * Pre-action gate for the combatant's current status.
     */
    public static GateResult beforeAction(Combatant combatant, RandomSource rng) {
        StatusHandler handler = HANDLERS.get(combatant.getStatus().type());
        if (handler == null) {
            return GateResult.proceed();
        }
        return handler.beforeAction(combatant, rng);
    }

    /**
     * End-of-turn tick for the combatant's current status.
     *
     * @return the log line, or null
     */
    public static String endOfTurn(Combatant combatant, RandomSource rng) {
        StatusHandler handler = HANDLERS.get(combatant.getStatus().type());
        if (handler == null || combatant.isFainted()) {
            return null;
        }
        return handler.endOfTurn(combatant, rng);
    }
}
