package com.ayjx.core.correlate;

import com.ayjx.core.event.CorrelationKey;

/**
 * What a waiter is waiting for.
 */
public sealed interface WaitCondition {

    boolean matches(CorrelationKey key);

    /** The reply to an API call sent with this echo token. */
    record ForEcho(String token) implements WaitCondition {
        @Override
        public boolean matches(CorrelationKey key) {
            return key instanceof CorrelationKey.Echo echo && echo.token().equals(token);
        }
    }

    /**
     * The next event from a group and/or user. A null id matches any value;
     * events carrying an echo token never match.
     */
    record ForSubject(Long groupId, Long userId) implements WaitCondition {
        @Override
        public boolean matches(CorrelationKey key) {
            if (!(key instanceof CorrelationKey.Subject subject)) {
                return false;
            }
            boolean groupMatches = groupId == null || groupId.equals(subject.groupId());
            boolean userMatches = userId == null || userId.equals(subject.userId());
            return groupMatches && userMatches;
        }
    }
}
