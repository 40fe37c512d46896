package com.ayjx.onebot.api;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.event.SendPacket;
import com.ayjx.core.pipeline.PluginException;
import com.ayjx.onebot.message.Message;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OneBot v11 actions on top of the connection's correlator.
 * <p>
 * A call registers a waiter for its echo token before the request is
 * written, so a fast reply cannot slip past it.
 */
@Slf4j
public final class OneBotApi {

    /** Uploads can be slow; match the platform's own patience. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final AtomicLong ECHO_COUNTER = new AtomicLong(1);

    private OneBotApi() {
    }

    static String nextEcho() {
        return "api-req-" + ECHO_COUNTER.getAndIncrement();
    }

    // =========================================================================
    // Generic calls
    // =========================================================================

    /**
     * Send {@code {action, params, echo}} and wait for the matching reply.
     *
     * @return the reply's {@code data} (a {@link NullNode} when absent)
     */
    public static JsonNode callAction(BotContext ctx, FrameWriter writer, String action, ObjectNode params)
            throws OneBotApiException {
        return callAction(ctx, writer, action, params, DEFAULT_TIMEOUT);
    }

    public static JsonNode callAction(BotContext ctx, FrameWriter writer, String action, ObjectNode params,
            Duration timeout) throws OneBotApiException {
        String echo = nextEcho();
        CompletableFuture<Optional<OneBotEvent>> reply = ctx.getCorrelator().waitForReply(echo, timeout);
        try {
            writer.send(request(action, params, echo));
        } catch (IOException e) {
            reply.cancel(false);
            throw new OneBotApiException(action, "send failed: " + e.getMessage(), e);
        }

        Optional<OneBotEvent> response;
        try {
            response = reply.get();
        } catch (InterruptedException e) {
            reply.cancel(false);
            Thread.currentThread().interrupt();
            throw new OneBotApiException(action, "interrupted");
        } catch (ExecutionException e) {
            throw new OneBotApiException(action, "wait failed", e.getCause());
        }
        if (response.isEmpty()) {
            throw new OneBotApiException(action, "API request timed out");
        }

        JsonNode json = response.get().json();
        int retcode = json.path("retcode").asInt(-1);
        if (retcode != 0) {
            String msg = json.path("msg").asText("");
            if (msg.isEmpty()) {
                msg = json.path("wording").asText("Unknown Error");
            }
            throw new OneBotApiException(action, retcode, "API call failed (retcode=" + retcode + "): " + msg, null);
        }
        JsonNode data = json.get("data");
        return data == null ? NullNode.getInstance() : data;
    }

    public static <T> T callAction(BotContext ctx, FrameWriter writer, String action, ObjectNode params,
            Class<T> type) throws OneBotApiException {
        return decode(action, callAction(ctx, writer, action, params), Json.MAPPER.constructType(type));
    }

    public static <T> T callAction(BotContext ctx, FrameWriter writer, String action, ObjectNode params,
            TypeReference<T> type) throws OneBotApiException {
        return decode(action, callAction(ctx, writer, action, params), Json.MAPPER.constructType(type));
    }

    /** Send a request without waiting for, or looking at, its reply. */
    public static void callActionNoWait(FrameWriter writer, String action, ObjectNode params)
            throws OneBotApiException {
        try {
            writer.send(request(action, params, nextEcho()));
        } catch (IOException e) {
            throw new OneBotApiException(action, "send failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Typed actions
    // =========================================================================

    public static OneBotTypes.LoginInfo getLoginInfo(BotContext ctx, FrameWriter writer) throws OneBotApiException {
        return callAction(ctx, writer, "get_login_info", Json.object(), OneBotTypes.LoginInfo.class);
    }

    public static List<OneBotTypes.GroupInfo> getGroupList(BotContext ctx, FrameWriter writer, boolean noCache)
            throws OneBotApiException {
        ObjectNode params = Json.object();
        if (noCache) {
            params.put("no_cache", true);
        }
        return callAction(ctx, writer, "get_group_list", params, new TypeReference<List<OneBotTypes.GroupInfo>>() {
        });
    }

    public static OneBotTypes.MessageData getMsg(BotContext ctx, FrameWriter writer, long messageId)
            throws OneBotApiException {
        return callAction(ctx, writer, "get_msg", Json.object().put("message_id", messageId),
                OneBotTypes.MessageData.class);
    }

    public static OneBotTypes.ForwardMessageData getForwardMsg(BotContext ctx, FrameWriter writer, String id)
            throws OneBotApiException {
        return callAction(ctx, writer, "get_forward_msg", Json.object().put("id", id),
                OneBotTypes.ForwardMessageData.class);
    }

    public static OneBotTypes.GroupMemberInfo getGroupMemberInfo(BotContext ctx, FrameWriter writer, long groupId,
            long userId, boolean noCache) throws OneBotApiException {
        ObjectNode params = Json.object()
                .put("group_id", groupId)
                .put("user_id", userId)
                .put("no_cache", noCache);
        return callAction(ctx, writer, "get_group_member_info", params, OneBotTypes.GroupMemberInfo.class);
    }

    public static void deleteMsg(FrameWriter writer, long messageId) throws OneBotApiException {
        callActionNoWait(writer, "delete_msg", Json.object().put("message_id", messageId));
    }

    public static void sendLike(FrameWriter writer, long userId, int times) throws OneBotApiException {
        callActionNoWait(writer, "send_like", Json.object().put("user_id", userId).put("times", times));
    }

    public static void setGroupSpecialTitle(FrameWriter writer, long groupId, long userId, String title,
            long durationSeconds) throws OneBotApiException {
        ObjectNode params = Json.object()
                .put("group_id", groupId)
                .put("user_id", userId)
                .put("special_title", title)
                .put("duration", durationSeconds);
        callActionNoWait(writer, "set_group_special_title", params);
    }

    // =========================================================================
    // Sending messages
    // =========================================================================

    /**
     * Send a message to a group when {@code groupId != 0}, otherwise privately
     * when {@code userId != 0}, otherwise do nothing. The {@code send_msg}
     * packet travels through the plugin pipeline first, so plugins may
     * rewrite or drop it.
     *
     * @return whether a packet was built
     */
    public static boolean sendMsg(BotContext ctx, FrameWriter writer, long groupId, long userId, JsonNode message)
            throws PluginException, IOException {
        ObjectNode params = Json.object();
        if (groupId != 0) {
            params.put("message_type", "group");
            params.put("group_id", groupId);
        } else if (userId != 0) {
            params.put("message_type", "private");
            params.put("user_id", userId);
        } else {
            return false;
        }
        params.set("message", message);
        SendPacket packet = new SendPacket("send_msg", params, originalEvent(ctx));
        ctx.getPipeline().send(ctx, writer, packet);
        return true;
    }

    public static boolean sendMsg(BotContext ctx, FrameWriter writer, long groupId, long userId, Message message)
            throws PluginException, IOException {
        return sendMsg(ctx, writer, groupId, userId, message.toJson());
    }

    public static boolean sendMsg(BotContext ctx, FrameWriter writer, long groupId, long userId, String text)
            throws PluginException, IOException {
        return sendMsg(ctx, writer, groupId, userId, Message.create().text(text));
    }

    /** Answer in the chat the current message came from. */
    public static boolean reply(BotContext ctx, FrameWriter writer, Message message)
            throws PluginException, IOException {
        var msg = ctx.asMessage();
        if (msg.isEmpty()) {
            return false;
        }
        return sendMsg(ctx, writer, msg.get().groupId(), msg.get().userId(), message);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static ObjectNode request(String action, ObjectNode params, String echo) {
        ObjectNode frame = Json.object();
        frame.put("action", action);
        frame.set("params", params);
        frame.put("echo", echo);
        return frame;
    }

    private static OneBotEvent originalEvent(BotContext ctx) {
        if (ctx.getEvent() instanceof OneBotEvent event) {
            return event;
        }
        if (ctx.getEvent() instanceof SendPacket packet) {
            return packet.originalEvent();
        }
        return null;
    }

    private static <T> T decode(String action, JsonNode data, JavaType type)
            throws OneBotApiException {
        try {
            return Json.MAPPER.convertValue(data, type);
        } catch (IllegalArgumentException e) {
            log.debug("[onebot] {} reply did not decode: {}", action, data);
            throw new OneBotApiException(action, "unexpected reply data: " + e.getMessage(), e);
        }
    }
}
