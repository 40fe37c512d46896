package com.ayjx.core.pipeline;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;

import java.util.Optional;

/**
 * Processes one context. Returning the (possibly replaced) context passes it
 * to the next plugin; returning empty marks the event handled and stops the
 * chain.
 */
@FunctionalInterface
public interface PluginHandler {

    Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception;
}
