package com.ayjx.browser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a correlated DevTools reply turned out to be.
 */
public sealed interface TransportResponse {

    /** Whole reply frame, {@code result} or {@code error} included. */
    JsonNode body();

    /** Direct reply to a browser-level command, matched by its outer id. */
    record Response(long id, JsonNode body) implements TransportResponse {
    }

    /**
     * Reply from inside a page session, unwrapped from a
     * {@code Target.receivedMessageFromTarget} envelope and matched by the
     * inner id.
     */
    record Target(JsonNode body) implements TransportResponse {
    }
}
