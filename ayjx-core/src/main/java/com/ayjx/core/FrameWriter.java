package com.ayjx.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Handle to the single writer of one connection. Implementations write one
 * whole frame at a time so concurrent callers never interleave.
 */
public interface FrameWriter {

    void send(String frame) throws IOException;

    default void send(JsonNode frame) throws IOException {
        send(frame.toString());
    }
}
