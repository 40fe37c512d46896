package com.ayjx.browser;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * Mailbox entries of the {@link CdpTransport} actor. Callers post the first
 * six kinds; the socket listener posts the last two.
 */
sealed interface TransportMessage {

    record Request(ObjectNode command, CompletableFuture<TransportResponse> reply) implements TransportMessage {
    }

    record ListenTargetMessage(long id, CompletableFuture<TransportResponse> reply) implements TransportMessage {
    }

    record WaitForEvent(String sessionId, String method, CompletableFuture<Void> reply)
            implements TransportMessage {
    }

    /** Drop the pending reply slot for {@code id}; its caller stopped waiting. */
    record Forget(long id) implements TransportMessage {
    }

    record PendingCount(CompletableFuture<Integer> reply) implements TransportMessage {
    }

    record Shutdown() implements TransportMessage {
    }

    record Incoming(String text) implements TransportMessage {
    }

    record SocketClosed(String reason) implements TransportMessage {
    }
}
