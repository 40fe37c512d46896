package com.ayjx.onebot.message;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fluent builder for a OneBot message chain ({@code [{type, data}, ...]}).
 *
 * <pre>
 *   Message.create().reply(messageId).at(userId).text(" done")
 * </pre>
 */
public final class Message {

    private final ArrayNode segments;

    private Message(ArrayNode segments) {
        this.segments = segments;
    }

    public static Message create() {
        return new Message(Json.MAPPER.createArrayNode());
    }

    /** Continue building on a copy of existing segments. */
    public static Message of(JsonNode segments) {
        Message message = create();
        if (segments != null && segments.isArray()) {
            segments.forEach(s -> message.segments.add(s.deepCopy()));
        }
        return message;
    }

    /** Append a segment with an arbitrary type. */
    public Message add(String type, ObjectNode data) {
        ObjectNode segment = segments.addObject();
        segment.put("type", type);
        segment.set("data", data);
        return this;
    }

    private Message add(String type, String key, String value) {
        return add(type, Json.object().put(key, value));
    }

    public Message text(String text) {
        return add("text", "text", text);
    }

    public Message face(Object id) {
        return add("face", "id", String.valueOf(id));
    }

    public Message image(String file) {
        return add("image", "file", file);
    }

    /** Image from raw bytes, sent inline as {@code base64://}. */
    public Message imageBase64(String base64) {
        return image("base64://" + base64);
    }

    public Message record(String file) {
        return add("record", "file", file);
    }

    public Message video(String file) {
        return add("video", "file", file);
    }

    public Message file(String file, String name) {
        ObjectNode data = Json.object().put("file", file);
        if (name != null) {
            data.put("name", name);
        }
        return add("file", data);
    }

    public Message at(Object userId) {
        return add("at", "qq", String.valueOf(userId));
    }

    public Message atAll() {
        return at("all");
    }

    public Message reply(Object messageId) {
        return add("reply", "id", String.valueOf(messageId));
    }

    public Message poke(Object userId) {
        return add("poke", "qq", String.valueOf(userId));
    }

    public Message dice() {
        return add("dice", Json.object());
    }

    public Message rps() {
        return add("rps", Json.object());
    }

    public Message json(String payload) {
        return add("json", "data", payload);
    }

    public Message markdown(String content) {
        return add("markdown", "content", content);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    /** The chain as sent on the wire. */
    public ArrayNode toJson() {
        return segments;
    }

    /** Concatenated text of all {@code text} segments. */
    public String plainText() {
        return plainText(segments);
    }

    public static String plainText(JsonNode segments) {
        StringBuilder sb = new StringBuilder();
        if (segments != null && segments.isArray()) {
            for (JsonNode segment : segments) {
                if ("text".equals(segment.path("type").asText())) {
                    sb.append(segment.path("data").path("text").asText());
                }
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
