package com.ayjx.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed view over a {@code post_type == "message"} event.
 */
public final class MessageEvent {

    private final ObjectNode json;

    MessageEvent(ObjectNode json) {
        this.json = json;
    }

    /** Group id, or 0 for private messages. */
    public long groupId() {
        Long id = OneBotEvent.longField(json, "group_id");
        return id == null ? 0 : id;
    }

    public long userId() {
        Long id = OneBotEvent.longField(json, "user_id");
        return id == null ? 0 : id;
    }

    public long messageId() {
        Long id = OneBotEvent.longField(json, "message_id");
        return id == null ? 0 : id;
    }

    /** Plain text ({@code raw_message}), empty when absent. */
    public String text() {
        String raw = OneBotEvent.text(json, "raw_message");
        return raw == null ? "" : raw;
    }

    public boolean isGroup() {
        return "group".equals(OneBotEvent.text(json, "message_type"));
    }

    /** Group card, else nickname, else "Unknown". */
    public String senderName() {
        JsonNode sender = json.path("sender");
        String card = OneBotEvent.text(sender, "card");
        if (card != null && !card.isEmpty()) {
            return card;
        }
        String nickname = OneBotEvent.text(sender, "nickname");
        return nickname != null ? nickname : "Unknown";
    }

    /** owner, admin or member; null outside groups. */
    public String senderRole() {
        return OneBotEvent.text(json.path("sender"), "role");
    }

    /**
     * Message segments. A string-form {@code message} is presented as a
     * single text segment.
     */
    public ArrayNode segments() {
        JsonNode message = json.get("message");
        if (message != null && message.isArray()) {
            return (ArrayNode) message;
        }
        ArrayNode single = json.arrayNode();
        if (message != null && message.isTextual()) {
            ObjectNode text = single.addObject();
            text.put("type", "text");
            text.putObject("data").put("text", message.asText());
        }
        return single;
    }
}
