package com.ayjx.plugins.repeater;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.event.SendPacket;
import com.ayjx.plugins.PluginHarness;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.ayjx.plugins.PluginHarness.groupMessage;
import static com.ayjx.plugins.PluginHarness.privateMessage;
import static com.ayjx.plugins.PluginHarness.text;
import static org.junit.jupiter.api.Assertions.*;

class RepeaterPluginTest {

    @TempDir
    Path tempDir;

    private PluginHarness harness(String config) throws Exception {
        return PluginHarness.create(tempDir, config, new RepeaterPlugin(() -> 0.0));
    }

    @Test
    void repeatsOnceTwoMembersPostTheSameMessage() throws Exception {
        try (PluginHarness harness = harness("{}")) {
            harness.dispatch(groupMessage(5, 1, 10, text("+1")));
            assertTrue(harness.frames.isEmpty());

            harness.dispatch(groupMessage(5, 2, 11, text("+1")));
            harness.dispatch(groupMessage(5, 3, 12, text("+1")));

            List<ObjectNode> sends = harness.framesFor("send_msg");
            assertEquals(1, sends.size(), "each message is repeated at most once");
            assertEquals(5, sends.get(0).path("params").path("group_id").asLong());
            assertEquals(text("+1"), sends.get(0).path("params").get("message"));
        }
    }

    @Test
    void sameMemberRepeatingDoesNotCount() throws Exception {
        try (PluginHarness harness = harness("{}")) {
            harness.dispatch(groupMessage(5, 1, 10, text("spam")));
            harness.dispatch(groupMessage(5, 1, 11, text("spam")));
            harness.dispatch(groupMessage(5, 1, 12, text("spam")));

            assertTrue(harness.frames.isEmpty());
        }
    }

    @Test
    void differentContentResetsTheCount() throws Exception {
        try (PluginHarness harness = harness("{}")) {
            harness.dispatch(groupMessage(5, 1, 10, text("a")));
            harness.dispatch(groupMessage(5, 2, 11, text("b")));
            harness.dispatch(groupMessage(5, 3, 12, text("a")));

            assertTrue(harness.frames.isEmpty());
        }
    }

    @Test
    void groupsAreTrackedSeparately() throws Exception {
        try (PluginHarness harness = harness("{}")) {
            harness.dispatch(groupMessage(5, 1, 10, text("x")));
            harness.dispatch(groupMessage(6, 2, 11, text("x")));

            assertTrue(harness.frames.isEmpty());
        }
    }

    @Test
    void thresholdAndProbabilityComeFromConfig() throws Exception {
        String config = """
                { "plugins": { "repeater": { "enabled": true, "minTimes": 3 } } }
                """;
        try (PluginHarness harness = harness(config)) {
            harness.dispatch(groupMessage(5, 1, 10, text("x")));
            harness.dispatch(groupMessage(5, 2, 11, text("x")));
            assertTrue(harness.frames.isEmpty());
            harness.dispatch(groupMessage(5, 3, 12, text("x")));
            assertEquals(1, harness.framesFor("send_msg").size());
        }
        String never = """
                { "plugins": { "repeater": { "enabled": true, "probability": 0.0 } } }
                """;
        try (PluginHarness harness = harness(never)) {
            harness.dispatch(groupMessage(5, 1, 10, text("x")));
            harness.dispatch(groupMessage(5, 2, 11, text("x")));
            assertTrue(harness.frames.isEmpty());
        }
    }

    @Test
    void botsOwnSendMarksTheMessageAsRepeated() throws Exception {
        try (PluginHarness harness = harness("{}")) {
            BotContext ctx = harness.context(groupMessage(5, 1, 10, text("hello")));
            ObjectNode params = Json.object().put("message_type", "group").put("group_id", 5);
            params.set("message", text("good morning"));
            harness.pipeline.send(ctx, harness, new SendPacket("send_msg", params, null));

            harness.dispatch(groupMessage(5, 1, 11, text("good morning")));
            harness.dispatch(groupMessage(5, 2, 12, text("good morning")));

            assertEquals(1, harness.framesFor("send_msg").size(), "only the bot's own packet");
        }
    }

    @Test
    void privateMessagesAreIgnored() throws Exception {
        RepeaterPlugin plugin = new RepeaterPlugin(() -> 0.0);
        try (PluginHarness harness = PluginHarness.create(tempDir, plugin)) {
            harness.dispatch(privateMessage(1, 10, text("x")));
            harness.dispatch(privateMessage(2, 11, text("x")));

            assertTrue(harness.frames.isEmpty());
            assertNull(plugin.state(0));
        }
    }

    @Test
    void observeTracksTimesAndLastSender() {
        RepeaterPlugin plugin = new RepeaterPlugin(() -> 0.5);
        RepeaterPlugin.RepeaterConfig config = new RepeaterPlugin.RepeaterConfig(true, 3, 0.4);

        assertFalse(plugin.observe(5, 1, text("x"), config));
        assertFalse(plugin.observe(5, 2, text("x"), config));
        assertFalse(plugin.observe(5, 3, text("x"), config), "0.5 is not below the 0.4 chance");

        RepeaterPlugin.ChannelState state = plugin.state(5);
        assertEquals(3, state.times);
        assertEquals(3, state.lastUserId);
        assertFalse(state.repeated);
    }
}
