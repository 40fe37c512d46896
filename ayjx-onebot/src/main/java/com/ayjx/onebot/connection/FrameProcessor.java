package com.ayjx.onebot.connection;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.pipeline.PluginException;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Turns inbound text frames into pipeline runs.
 * <p>
 * Order of work for one event: offer it to the correlator, drop it if the
 * global group filter rejects it, otherwise run the plugin pipeline. Every
 * failure stays local to the frame.
 */
@Slf4j
public final class FrameProcessor {

    private FrameProcessor() {
    }

    /**
     * Decode one frame. Malformed input is logged at DEBUG and dropped.
     */
    public static Optional<OneBotEvent> decode(String text) {
        try {
            return Optional.of(OneBotEvent.of(Json.parseObject(text)));
        } catch (JsonProcessingException e) {
            log.debug("[onebot] dropping malformed frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public static void process(OneBotEvent event, BotContext ctx, FrameWriter writer) {
        Optional<OneBotEvent> unconsumed = ctx.getCorrelator().dispatch(event);
        if (unconsumed.isEmpty()) {
            return;
        }
        Long groupId = event.groupId().orElse(null);
        if (groupId != null && !ctx.getConfig().allowsGroup(groupId)) {
            log.trace("[onebot] group {} filtered", groupId);
            return;
        }
        try {
            ctx.getPipeline().run(ctx.withEvent(event), writer);
        } catch (PluginException e) {
            log.error("[onebot] plugin {} failed: {}", e.getPluginName(), e.getMessage(), e.getCause());
        } catch (IOException e) {
            log.warn("[onebot] failed to write outgoing frame: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[onebot] event processing error: {}", e.getMessage(), e);
        }
    }
}
