package com.ayjx.core.pipeline;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A feature registered in the {@link PluginPipeline}.
 */
public interface BotPlugin extends PluginHandler {

    /** Config key under {@code plugins}; unique within a pipeline. */
    String name();

    /**
     * Block written into the config the first time the plugin is seen.
     * Must contain {@code enabled}.
     */
    default ObjectNode defaultConfig() {
        return Json.object().put("enabled", true);
    }

    /** Called once at startup with a context carrying the startup event. */
    default void init(BotContext ctx) throws Exception {
    }

    /** Called each time a connection has learned its bot identity. */
    default void onConnected(BotContext ctx, FrameWriter writer) throws Exception {
    }

    /** Release threads or other resources the plugin holds. Called once, at shutdown. */
    default void shutdown() throws Exception {
    }
}
