package com.ayjx.plugins.repeater;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.MessageEvent;
import com.ayjx.core.event.SendPacket;
import com.ayjx.core.pipeline.BotPlugin;
import com.ayjx.onebot.api.OneBotApi;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Joins in when several different members of a group post the same message
 * in a row. Each group repeats a given message at most once; the bot's own
 * sends count as a participant so it never echoes itself.
 */
@Slf4j
public class RepeaterPlugin implements BotPlugin {

    public static final String NAME = "repeater";

    /** Stands in for the bot as the last sender. */
    static final long BOT_SELF = -1L;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RepeaterConfig {
        private boolean enabled = true;
        /** Distinct consecutive senders needed before repeating. */
        private int minTimes = 2;
        /** Chance to repeat once the threshold is reached, 0.0 to 1.0. */
        private double probability = 1.0;
    }

    static final class ChannelState {
        final JsonNode content;
        boolean repeated;
        int times;
        long lastUserId;

        ChannelState(JsonNode content, long lastUserId, boolean repeated) {
            this.content = content;
            this.lastUserId = lastUserId;
            this.repeated = repeated;
            this.times = 1;
        }
    }

    private final Cache<Long, ChannelState> channels = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(Duration.ofHours(12))
            .build();
    private final DoubleSupplier random;

    public RepeaterPlugin() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    RepeaterPlugin(DoubleSupplier random) {
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode defaultConfig() {
        return Json.MAPPER.valueToTree(new RepeaterConfig());
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception {
        Optional<SendPacket> packet = ctx.sendPacket();
        if (packet.isPresent()) {
            trackOwnSend(packet.get());
            return Optional.of(ctx);
        }
        Optional<MessageEvent> message = ctx.asMessage();
        if (message.isEmpty() || message.get().groupId() == 0) {
            return Optional.of(ctx);
        }
        MessageEvent msg = message.get();
        JsonNode content = ctx.oneBotEvent().orElseThrow().json().get("message");
        if (content == null || content.isNull()) {
            return Optional.of(ctx);
        }
        RepeaterConfig config = ctx.getConfig().pluginConfig(NAME, RepeaterConfig.class);
        if (observe(msg.groupId(), msg.userId(), content, config)) {
            log.info("[repeater] repeating in group {}", msg.groupId());
            OneBotApi.sendMsg(ctx, writer, msg.groupId(), 0, content.deepCopy());
        }
        return Optional.of(ctx);
    }

    /**
     * Record a member's message.
     *
     * @return whether the bot should repeat it now
     */
    boolean observe(long groupId, long userId, JsonNode content, RepeaterConfig config) {
        boolean[] fire = {false};
        channels.asMap().compute(groupId, (id, state) -> {
            if (state == null || !state.content.equals(content)) {
                return new ChannelState(content.deepCopy(), userId, false);
            }
            if (state.lastUserId != userId) {
                state.times++;
                state.lastUserId = userId;
                if (!state.repeated && state.times >= config.getMinTimes()
                        && random.getAsDouble() < config.getProbability()) {
                    state.repeated = true;
                    fire[0] = true;
                }
            }
            return state;
        });
        return fire[0];
    }

    private void trackOwnSend(SendPacket packet) {
        Long groupId = packet.groupId();
        JsonNode content = packet.message();
        if (!"send_msg".equals(packet.action()) || groupId == null || content == null) {
            return;
        }
        channels.asMap().compute(groupId, (id, state) -> {
            if (state == null || !state.content.equals(content)) {
                return new ChannelState(content.deepCopy(), BOT_SELF, true);
            }
            if (state.lastUserId != BOT_SELF) {
                state.times++;
                state.lastUserId = BOT_SELF;
            }
            state.repeated = true;
            return state;
        });
    }

    /** Current state of a group, for tests. */
    ChannelState state(long groupId) {
        return channels.getIfPresent(groupId);
    }
}
