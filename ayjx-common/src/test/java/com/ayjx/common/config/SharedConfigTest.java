package com.ayjx.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SharedConfigTest {

    @TempDir
    Path tempDir;
    private Path configPath;
    private ConfigService service;

    @Data
    static class CounterConfig {
        private boolean enabled;
        private int count;
        private List<Long> ids = new ArrayList<>();
    }

    @BeforeEach
    void setUp() throws IOException {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
                {
                  "plugins": {
                    "echo": { "enabled": true },
                    "counter": { "enabled": false, "count": 3, "extra": "kept" }
                  }
                }
                """);
        service = new ConfigService(configPath);
    }

    @Test
    void enabledPlugins_onlyTrueFlags() {
        SharedConfig shared = new SharedConfig(service);

        assertEquals(Set.of("echo"), shared.enabledPlugins());
        assertTrue(shared.isPluginEnabled("echo"));
        assertFalse(shared.isPluginEnabled("counter"));
        assertFalse(shared.isPluginEnabled("missing"));
    }

    @Test
    void pluginConfig_missingBlock_yieldsDefaults() {
        SharedConfig shared = new SharedConfig(service);

        CounterConfig cfg = shared.pluginConfig("nothing", CounterConfig.class);

        assertFalse(cfg.isEnabled());
        assertEquals(0, cfg.getCount());
    }

    @Test
    void updatePluginConfig_persistsAndKeepsUnknownFields() {
        SharedConfig shared = new SharedConfig(service);

        assertTrue(shared.updatePluginConfig("counter", CounterConfig.class, c -> c.setCount(c.getCount() + 1)));

        AyjxConfig onDisk = service.reloadConfig();
        ObjectNode block = onDisk.getPlugins().get("counter");
        assertEquals(4, block.path("count").asInt());
        assertEquals("kept", block.path("extra").asText());
    }

    @Test
    void setPluginEnabled_togglesAndPersists() {
        SharedConfig shared = new SharedConfig(service);

        shared.setPluginEnabled("counter", true);

        assertTrue(shared.isPluginEnabled("counter"));
        assertTrue(service.reloadConfig().getPlugins().get("counter").path("enabled").asBoolean());
    }

    @Test
    void ensurePluginDefaults_addsMissingBlocksAndKeys() {
        SharedConfig shared = new SharedConfig(service);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode repeaterDefaults = mapper.createObjectNode().put("enabled", true).put("threshold", 3);
        ObjectNode counterDefaults = mapper.createObjectNode().put("enabled", true).put("count", 0).put("limit", 9);

        shared.ensurePluginDefaults(Map.of("repeater", repeaterDefaults, "counter", counterDefaults));

        AyjxConfig snapshot = shared.snapshot();
        assertEquals(3, snapshot.getPlugins().get("repeater").path("threshold").asInt());
        ObjectNode counter = snapshot.getPlugins().get("counter");
        assertFalse(counter.path("enabled").asBoolean());
        assertEquals(3, counter.path("count").asInt());
        assertEquals(9, counter.path("limit").asInt());
        assertTrue(service.reloadConfig().getPlugins().containsKey("repeater"));
    }

    @Test
    void snapshot_isDetachedFromLiveConfig() {
        SharedConfig shared = new SharedConfig(service);

        AyjxConfig snapshot = shared.snapshot();
        snapshot.getPlugins().get("echo").put("enabled", false);

        assertTrue(shared.isPluginEnabled("echo"));
    }

    @Test
    void reload_picksUpExternalEdits() throws IOException {
        SharedConfig shared = new SharedConfig(service);
        Files.writeString(configPath, """
                { "plugins": { "logger": { "enabled": true } } }
                """);

        shared.reload();

        assertEquals(Set.of("logger"), shared.enabledPlugins());
    }

    @Test
    void concurrentUpdates_allApplied() throws Exception {
        SharedConfig shared = new SharedConfig(service);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch done = new CountDownLatch(writers);
        for (int i = 0; i < writers; i++) {
            long id = i;
            pool.execute(() -> {
                shared.updatePluginConfig("counter", CounterConfig.class, c -> c.getIds().add(id));
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(writers, shared.pluginConfig("counter", CounterConfig.class).getIds().size());
        assertEquals(writers, service.reloadConfig().getPlugins().get("counter").path("ids").size());
    }
}
