package com.questrail.concord.coordination.session;

import com.questrail.concord.model.Move;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of {@link SessionStateRule}s keyed by session type. Types without a
 * rule leave the state untouched.
 */
public final class SessionStateRules
{
    public static final String TURN_BASED = "turn_based";

    static final String LAST_PLAYER = "last_player";
    static final String TURN_COUNT = "turn_count";

    private static final SessionStateRule UNCHANGED = (state, move) -> {};

    private final Map<String, SessionStateRule> rules = new HashMap<>();

    /**
     * Registry holding the built-in {@value #TURN_BASED} rule.
     */
    public static SessionStateRules withDefaults() {
        return new SessionStateRules().register(TURN_BASED, SessionStateRules::turnBased);
    }

    public SessionStateRules register(String sessionType, SessionStateRule rule) {
        rules.put(Objects.requireNonNull(sessionType, "sessionType"), Objects.requireNonNull(rule, "rule"));
        return this;
    }

    public SessionStateRule forType(String sessionType) {
        return rules.getOrDefault(sessionType, UNCHANGED);
    }

    /**
     * Records who moved last and counts turns.
     */
    static void turnBased(Map<String, Object> state, Move move) {
        state.put(LAST_PLAYER, move.originator());
        Object count = state.get(TURN_COUNT);
        long turns = count instanceof Number n ? n.longValue() : 0L;
        state.put(TURN_COUNT, turns + 1);
    }
}
