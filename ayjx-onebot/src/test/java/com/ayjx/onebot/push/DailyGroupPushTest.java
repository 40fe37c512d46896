package com.ayjx.onebot.push;

import com.ayjx.common.config.ConfigService;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.core.schedule.TaskScheduler;
import com.ayjx.onebot.FakeOneBot;
import com.ayjx.onebot.api.OneBotApi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DailyGroupPushTest {

    @TempDir
    Path tempDir;
    private Correlator correlator;
    private TaskScheduler scheduler;
    private FakeOneBot bot;
    private BotContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, """
                {
                  "globalFilter": { "enableBlacklist": true, "blacklist": [20] },
                  "push": { "groupDelayMs": 0 }
                }
                """);
        correlator = new Correlator();
        scheduler = new TaskScheduler();
        bot = new FakeOneBot(correlator);
        bot.onAction("get_group_list", Json.MAPPER.readTree("""
                [ {"group_id": 10, "group_name": "a"},
                  {"group_id": 20, "group_name": "blocked"},
                  {"group_id": 30, "group_name": "c"} ]
                """));
        ctx = BotContext.builder()
                .config(new SharedConfig(new ConfigService(path)))
                .correlator(correlator)
                .scheduler(scheduler)
                .pipeline(PluginPipeline.builder().build())
                .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        correlator.close();
    }

    @Test
    void runOnce_visitsEveryAllowedGroup() throws Exception {
        List<Long> visited = new ArrayList<>();

        List<Long> targets = DailyGroupPush.runOnce(ctx, bot, "test", (groupId, c, w) -> visited.add(groupId));

        assertEquals(List.of(10L, 30L), targets);
        assertEquals(List.of(10L, 30L), visited);
    }

    @Test
    void runOnce_failingGroupDoesNotStopTheRest() throws Exception {
        List<Long> visited = new ArrayList<>();

        DailyGroupPush.runOnce(ctx, bot, "test", (groupId, c, w) -> {
            visited.add(groupId);
            if (groupId == 10L) {
                throw new IllegalStateException("boom");
            }
        });

        assertEquals(List.of(10L, 30L), visited);
    }

    @Test
    void runOnce_sendsThroughApi() throws Exception {
        DailyGroupPush.runOnce(ctx, bot, "news", (groupId, c, w) ->
                OneBotApi.sendMsg(c, w, groupId, 0, "morning"));

        assertEquals(2, bot.framesFor("send_msg").size());
        assertEquals(30, bot.framesFor("send_msg").get(1).path("params").path("group_id").asLong());
    }

    @Test
    void runOnce_groupListFailureSkipsRound() throws Exception {
        bot.onAction("get_group_list", p -> Json.object().put("retcode", 1400).put("msg", "offline"));

        List<Long> targets = DailyGroupPush.runOnce(ctx, bot, "test", (groupId, c, w) -> fail("must not run"));

        assertTrue(targets.isEmpty());
    }

    @Test
    void schedule_registersWithScheduler() {
        DailyGroupPush.schedule(ctx, bot, "test", "08:30:00", (groupId, c, w) -> { });
        assertEquals(1, scheduler.size());
    }

    @Test
    void schedule_rejectsMalformedTime() {
        assertThrows(IllegalArgumentException.class,
                () -> DailyGroupPush.schedule(ctx, bot, "test", "8h30", (groupId, c, w) -> { }));
        assertEquals(0, scheduler.size());
    }
}
