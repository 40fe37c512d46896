package com.ayjx.plugins.basic;

import com.ayjx.common.infra.Json;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.BotEvent;
import com.ayjx.core.event.MessageEvent;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.event.SendPacket;
import com.ayjx.core.pipeline.BotPlugin;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Writes one line per inbound chat message and per outgoing
 * {@code send_msg} to the {@code chat} logger. Always passes the event on.
 */
@Slf4j
public class LoggerPlugin implements BotPlugin {

    public static final String NAME = "logger";

    static final Logger CHAT = LoggerFactory.getLogger("chat");

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LoggerConfig {
        private boolean enabled = true;
        /** Also dump every raw event and packet at debug level. */
        private boolean debug;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode defaultConfig() {
        return Json.MAPPER.valueToTree(new LoggerConfig());
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) {
        LoggerConfig config = ctx.getConfig().pluginConfig(NAME, LoggerConfig.class);
        BotEvent event = ctx.getEvent();
        if (event instanceof OneBotEvent inbound) {
            if (config.isDebug()) {
                log.debug("[logger] event: {}", inbound);
            }
            logInbound(inbound);
        } else if (event instanceof SendPacket packet) {
            if (config.isDebug()) {
                log.debug("[logger] packet: {}", packet);
            }
            logOutbound(packet);
        }
        return Optional.of(ctx);
    }

    private void logInbound(OneBotEvent event) {
        Optional<MessageEvent> message = event.asMessage();
        if (message.isPresent()) {
            MessageEvent msg = message.get();
            String content = formatMessage(event.json().get("message"));
            String sender = msg.senderName() + "(" + msg.userId() + ")";
            if (msg.groupId() != 0) {
                CHAT.info("recv <- group [Group({})] [{}] {}", msg.groupId(), sender, content);
            } else {
                CHAT.info("recv <- private [{}] {}", sender, content);
            }
            return;
        }
        event.postType()
                .filter(type -> !"meta_event".equals(type))
                .ifPresent(type -> log.debug("[logger] event type: {}", type));
    }

    private void logOutbound(SendPacket packet) {
        if (!"send_msg".equals(packet.action())) {
            log.debug("[logger] action: {}", packet.action());
            return;
        }
        ObjectNode params = packet.params();
        String type = packet.messageType() == null ? "unknown" : packet.messageType();
        String content = formatMessage(packet.message());
        switch (type) {
            case "group":
                CHAT.info("send -> group [Group({})] {}", params.path("group_id").asLong(0), content);
                break;
            case "private":
                CHAT.info("send -> private [User({})] {}", params.path("user_id").asLong(0), content);
                break;
            default:
                CHAT.info("send -> unknown [{}] {}", type, content);
        }
    }

    /**
     * Human-readable rendering of a message: strings as they are, text
     * segments inline, everything else as a bracketed placeholder.
     */
    static String formatMessage(JsonNode message) {
        if (message == null || message.isNull()) {
            return "";
        }
        if (message.isTextual()) {
            return message.asText();
        }
        if (!message.isArray()) {
            return "[complex message]";
        }
        StringBuilder out = new StringBuilder();
        for (JsonNode segment : message) {
            String type = segment.path("type").asText("unknown");
            JsonNode data = segment.path("data");
            switch (type) {
                case "text":
                    out.append(data.path("text").asText(""));
                    break;
                case "at":
                    out.append(" [@").append(data.path("qq").asText("")).append("] ");
                    break;
                case "face":
                    out.append(" [face] ");
                    break;
                case "image":
                    out.append(" [image] ");
                    break;
                case "record":
                    out.append(" [voice] ");
                    break;
                case "video":
                    out.append(" [video] ");
                    break;
                case "reply":
                    out.append(" [reply] ");
                    break;
                case "json":
                    out.append(" [card] ");
                    break;
                case "poke":
                    out.append(" [poke] ");
                    break;
                default:
                    out.append(" [").append(type).append("] ");
            }
        }
        return out.toString();
    }
}
