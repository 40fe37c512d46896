package com.ayjx.onebot.connection;

import com.ayjx.common.config.ConfigService;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.core.BotContext;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.onebot.FakeOneBot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class FrameProcessorTest {

    @TempDir
    Path tempDir;
    private Correlator correlator;
    private FakeOneBot writer;
    private List<Long> seen;
    private BotContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, """
                {
                  "globalFilter": { "enableBlacklist": true, "blacklist": [666] },
                  "plugins": { "recorder": { "enabled": true }, "boom": { "enabled": true } }
                }
                """);
        correlator = new Correlator();
        writer = new FakeOneBot(correlator);
        seen = new ArrayList<>();
        PluginPipeline pipeline = PluginPipeline.builder()
                .register("boom", (c, w) -> {
                    if (c.oneBotEvent().orElseThrow().json().path("boom").asBoolean()) {
                        throw new IllegalStateException("kaboom");
                    }
                    return Optional.of(c);
                })
                .register("recorder", (c, w) -> {
                    seen.add(c.oneBotEvent().orElseThrow().json().path("user_id").asLong());
                    return Optional.of(c);
                })
                .build();
        ctx = BotContext.builder()
                .config(new SharedConfig(new ConfigService(path)))
                .correlator(correlator)
                .pipeline(pipeline)
                .build();
    }

    @AfterEach
    void tearDown() {
        correlator.close();
    }

    private OneBotEvent event(String json) {
        return FrameProcessor.decode(json).orElseThrow();
    }

    @Test
    void decode_rejectsMalformedAndNonObjectFrames() {
        assertTrue(FrameProcessor.decode("{not json").isEmpty());
        assertTrue(FrameProcessor.decode("[1,2]").isEmpty());
        assertTrue(FrameProcessor.decode("{\"post_type\":\"meta_event\"}").isPresent());
    }

    @Test
    void process_runsPipelineForAllowedGroup() {
        FrameProcessor.process(event("{\"post_type\":\"message\",\"group_id\":1,\"user_id\":2}"), ctx, writer);
        assertEquals(List.of(2L), seen);
    }

    @Test
    void process_dropsBlockedGroup() {
        FrameProcessor.process(event("{\"post_type\":\"message\",\"group_id\":666,\"user_id\":2}"), ctx, writer);
        assertTrue(seen.isEmpty());
    }

    @Test
    void process_filterOnlyAppliesToNumericGroupId() {
        FrameProcessor.process(event("{\"post_type\":\"message\",\"group_id\":\"666\",\"user_id\":3}"), ctx, writer);
        FrameProcessor.process(event("{\"post_type\":\"message\",\"user_id\":4}"), ctx, writer);
        assertEquals(List.of(3L, 4L), seen);
    }

    @Test
    void process_eventConsumedByWaiterSkipsPipeline() throws Exception {
        CompletableFuture<Optional<OneBotEvent>> wait = correlator.waitForMessage(1L, 2L, Duration.ofSeconds(5));

        FrameProcessor.process(event("{\"post_type\":\"message\",\"group_id\":1,\"user_id\":2}"), ctx, writer);

        assertTrue(wait.get().isPresent());
        assertTrue(seen.isEmpty());
    }

    @Test
    void process_pluginErrorStaysWithinFrame() {
        FrameProcessor.process(event("{\"post_type\":\"message\",\"user_id\":5,\"boom\":true}"), ctx, writer);
        FrameProcessor.process(event("{\"post_type\":\"message\",\"user_id\":6}"), ctx, writer);
        assertEquals(List.of(6L), seen);
    }
}
