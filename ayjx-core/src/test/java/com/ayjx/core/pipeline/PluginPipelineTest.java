package com.ayjx.core.pipeline;

import com.ayjx.common.config.ConfigService;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.RecordingWriter;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.event.SendPacket;
import com.ayjx.core.event.StartupEvent;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PluginPipelineTest {

    @TempDir
    Path tempDir;
    private SharedConfig config;
    private RecordingWriter writer;
    private List<String> seen;

    @BeforeEach
    void setUp() throws IOException {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, """
                {
                  "plugins": {
                    "a": { "enabled": true },
                    "b": { "enabled": true },
                    "c": { "enabled": true },
                    "off": { "enabled": false }
                  }
                }
                """);
        config = new SharedConfig(new ConfigService(path));
        writer = new RecordingWriter();
        seen = new ArrayList<>();
    }

    private PluginHandler recording(String name) {
        return (ctx, w) -> {
            seen.add(name);
            return Optional.of(ctx);
        };
    }

    private BotContext context(PluginPipeline pipeline) throws Exception {
        return BotContext.builder()
                .event(OneBotEvent.of(Json.parseObject("{\"post_type\":\"message\",\"user_id\":1}")))
                .config(config)
                .pipeline(pipeline)
                .build();
    }

    @Test
    void run_stopAtK_laterPluginsNeverSeeContext() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", recording("a"))
                .register("b", (ctx, w) -> {
                    seen.add("b");
                    return Optional.empty();
                })
                .register("c", recording("c"))
                .build();

        pipeline.run(context(pipeline), writer);

        assertEquals(List.of("a", "b"), seen);
    }

    @Test
    void run_disabledPluginsSkipped() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("off", recording("off"))
                .register("unknown", recording("unknown"))
                .register("a", recording("a"))
                .build();

        pipeline.run(context(pipeline), writer);

        assertEquals(List.of("a"), seen);
    }

    @Test
    void run_enableFlagReadPerRun() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("off", recording("off"))
                .build();

        pipeline.run(context(pipeline), writer);
        config.setPluginEnabled("off", true);
        pipeline.run(context(pipeline), writer);

        assertEquals(List.of("off"), seen);
    }

    @Test
    void run_replacedContextFlowsToNextPlugin() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", (ctx, w) -> Optional.of(
                        ctx.withEvent(OneBotEvent.of(Json.parseObject("{\"post_type\":\"notice\"}")))))
                .register("b", (ctx, w) -> {
                    seen.add(ctx.postType().orElse("?"));
                    return Optional.of(ctx);
                })
                .build();

        pipeline.run(context(pipeline), writer);

        assertEquals(List.of("notice"), seen);
    }

    @Test
    void send_packetSurvivingChain_isWritten() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", (ctx, w) -> {
                    SendPacket packet = ctx.sendPacket().orElseThrow();
                    packet.params().put("message", "rewritten");
                    return Optional.of(ctx);
                })
                .build();
        ObjectNode params = Json.object().put("message_type", "private").put("user_id", 1).put("message", "hi");

        pipeline.send(context(pipeline), writer, new SendPacket("send_msg", params, null));

        assertEquals(1, writer.frames.size());
        ObjectNode frame = Json.parseObject(writer.frames.get(0));
        assertEquals("send_msg", frame.path("action").asText());
        assertEquals("rewritten", frame.path("params").path("message").asText());
        assertFalse(frame.has("echo"));
    }

    @Test
    void send_vetoedPacket_isNotWritten() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", (ctx, w) -> ctx.sendPacket().isPresent() ? Optional.empty() : Optional.of(ctx))
                .build();

        pipeline.send(context(pipeline), writer, new SendPacket("send_msg", Json.object(), null));

        assertTrue(writer.frames.isEmpty());
    }

    @Test
    void run_inboundEventReachingEnd_writesNothing() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder().register("a", recording("a")).build();

        pipeline.run(context(pipeline), writer);

        assertTrue(writer.frames.isEmpty());
    }

    @Test
    void run_handlerThrows_wrappedWithPluginName() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", (ctx, w) -> {
                    throw new IllegalStateException("broken");
                })
                .register("b", recording("b"))
                .build();

        PluginException e = assertThrows(PluginException.class, () -> pipeline.run(context(pipeline), writer));

        assertEquals("a", e.getPluginName());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(seen.isEmpty());
    }

    @Test
    void runInit_failingPlugin_doesNotStopOthers() throws Exception {
        List<String> inits = new ArrayList<>();
        PluginPipeline pipeline = PluginPipeline.builder()
                .register(new TestPlugin("a", inits, true))
                .register(new TestPlugin("b", inits, false))
                .register(new TestPlugin("off", inits, false))
                .build();

        pipeline.runInit(context(pipeline).withEvent(StartupEvent.INSTANCE));

        assertEquals(List.of("a", "b"), inits);
    }

    @Test
    void runConnected_callsEnabledPlugins() throws Exception {
        List<String> calls = new ArrayList<>();
        PluginPipeline pipeline = PluginPipeline.builder()
                .register(new TestPlugin("a", calls, false))
                .register(new TestPlugin("off", calls, false))
                .build();

        pipeline.runConnected(context(pipeline), writer);

        assertEquals(List.of("connected:a"), calls);
    }

    @Test
    void sendFakeEvent_runsChainWithNewEvent() throws Exception {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("a", (ctx, w) -> {
                    seen.add(ctx.asMessage().map(m -> m.text()).orElse(""));
                    return Optional.of(ctx);
                })
                .build();

        pipeline.sendFakeEvent(context(pipeline), writer, OneBotEvent.of(Json.parseObject(
                "{\"post_type\":\"message\",\"raw_message\":\"fake\"}")));

        assertEquals(List.of("fake"), seen);
    }

    @Test
    void builder_rejectsDuplicateNames() {
        PluginPipeline.Builder builder = PluginPipeline.builder().register("a", recording("a"));
        assertThrows(IllegalArgumentException.class, () -> builder.register("a", recording("a")));
    }

    @Test
    void defaultConfigs_inRegistrationOrder() {
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("z", recording("z"))
                .register("a", recording("a"))
                .build();

        assertEquals(List.of("z", "a"), new ArrayList<>(pipeline.defaultConfigs().keySet()));
        assertTrue(pipeline.defaultConfigs().get("z").path("enabled").asBoolean());
    }

    private static final class TestPlugin implements BotPlugin {
        private final String name;
        private final List<String> log;
        private final boolean failInit;

        TestPlugin(String name, List<String> log, boolean failInit) {
            this.name = name;
            this.log = log;
            this.failInit = failInit;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) {
            return Optional.of(ctx);
        }

        @Override
        public void init(BotContext ctx) throws Exception {
            log.add(name);
            if (failInit) {
                throw new IOException("no database");
            }
        }

        @Override
        public void onConnected(BotContext ctx, FrameWriter writer) {
            log.add("connected:" + name);
        }
    }

    @Test
    void close_shutsPluginsDownInReverseOrderDespiteFailures() {
        List<String> stopped = new ArrayList<>();
        PluginPipeline pipeline = PluginPipeline.builder()
                .register(stoppable("first", stopped, false))
                .register(stoppable("broken", stopped, true))
                .register(stoppable("last", stopped, false))
                .build();

        pipeline.close();

        assertEquals(List.of("last", "broken", "first"), stopped);
    }

    private static BotPlugin stoppable(String name, List<String> stopped, boolean fails) {
        return new BotPlugin() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) {
                return Optional.of(ctx);
            }

            @Override
            public void shutdown() throws IOException {
                stopped.add(name);
                if (fails) {
                    throw new IOException("cannot release " + name);
                }
            }
        };
    }
}
