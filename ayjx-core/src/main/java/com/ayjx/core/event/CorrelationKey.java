package com.ayjx.core.event;

/**
 * How an inbound event can be matched against a pending waiter. Computed
 * once when the frame is decoded.
 */
public sealed interface CorrelationKey {

    /** Reply to an API call; carries the caller's echo token. */
    record Echo(String token) implements CorrelationKey {
    }

    /**
     * Ordinary event about a group and/or user. Either id may be null, but
     * not both.
     */
    record Subject(Long groupId, Long userId) implements CorrelationKey {
    }

    /** Nothing to correlate on (meta events, notices without ids). */
    record None() implements CorrelationKey {
    }
}
