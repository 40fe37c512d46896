package com.ayjx.plugins;

import com.ayjx.common.config.ConfigService;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.BotStatus;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.pipeline.BotPlugin;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.onebot.message.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A pipeline of the plugins under test, a config file, and a writer that
 * records every frame.
 */
public class PluginHarness implements FrameWriter, AutoCloseable {

    public static final String SELF_ID = "10000";

    public final List<ObjectNode> frames = new CopyOnWriteArrayList<>();
    public final SharedConfig config;
    public final PluginPipeline pipeline;
    private final Correlator correlator = new Correlator();

    private PluginHarness(SharedConfig config, PluginPipeline pipeline) {
        this.config = config;
        this.pipeline = pipeline;
    }

    /**
     * @param configJson written as the config file; defaults of every plugin
     *                   are merged in, so plugins start enabled unless the
     *                   file says otherwise
     */
    public static PluginHarness create(Path dir, String configJson, BotPlugin... plugins) throws IOException {
        Path path = dir.resolve("config.json");
        Files.writeString(path, configJson);
        PluginPipeline.Builder builder = PluginPipeline.builder();
        for (BotPlugin plugin : plugins) {
            builder.register(plugin);
        }
        PluginPipeline pipeline = builder.build();
        SharedConfig config = new SharedConfig(new ConfigService(path));
        config.ensurePluginDefaults(pipeline.defaultConfigs());
        return new PluginHarness(config, pipeline);
    }

    public static PluginHarness create(Path dir, BotPlugin... plugins) throws IOException {
        return create(dir, "{}", plugins);
    }

    public BotContext context(ObjectNode event) {
        BotStatus bot = new BotStatus("onebot", "qq",
                new BotStatus.LoginUser(SELF_ID, "ayjx", "ayjx", null));
        return BotContext.builder()
                .event(OneBotEvent.of(event))
                .config(config)
                .correlator(correlator)
                .pipeline(pipeline)
                .bot(bot)
                .build();
    }

    /** Run an inbound event through the whole pipeline. */
    public void dispatch(ObjectNode event) throws Exception {
        pipeline.run(context(event), this);
    }

    public List<ObjectNode> framesFor(String action) {
        return frames.stream().filter(f -> action.equals(f.path("action").asText())).toList();
    }

    @Override
    public void send(String frame) throws IOException {
        frames.add(Json.parseObject(frame));
    }

    @Override
    public void close() {
        pipeline.close();
        correlator.close();
    }

    // =========================================================================
    // Event builders
    // =========================================================================

    public static ObjectNode groupMessage(long groupId, long userId, long messageId, JsonNode message) {
        ObjectNode event = message(userId, messageId, message);
        event.put("message_type", "group");
        event.put("group_id", groupId);
        return event;
    }

    public static ObjectNode privateMessage(long userId, long messageId, JsonNode message) {
        ObjectNode event = message(userId, messageId, message);
        event.put("message_type", "private");
        return event;
    }

    public static ArrayNode text(String text) {
        ArrayNode chain = Json.MAPPER.createArrayNode();
        chain.addObject().put("type", "text").putObject("data").put("text", text);
        return chain;
    }

    private static ObjectNode message(long userId, long messageId, JsonNode message) {
        ObjectNode event = Json.object()
                .put("post_type", "message")
                .put("user_id", userId)
                .put("message_id", messageId)
                .put("raw_message", Message.plainText(message));
        event.putObject("sender").put("nickname", "user" + userId);
        event.set("message", message);
        return event;
    }
}
