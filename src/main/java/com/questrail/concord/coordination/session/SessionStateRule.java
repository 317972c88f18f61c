package com.questrail.concord.coordination.session;

import com.questrail.concord.model.Move;

import java.util.Map;

/**
 * Derives a session's state from its moves. One rule per session type.
 *
 * <p>Rules run on every replica for every accepted move, in sequence order,
 * so they must be deterministic functions of the state and the move.</p>
 */
@FunctionalInterface
public interface SessionStateRule
{
    void apply(Map<String, Object> state, Move move);
}
