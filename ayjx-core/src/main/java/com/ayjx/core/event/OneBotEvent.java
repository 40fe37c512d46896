package com.ayjx.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * A decoded inbound frame from the OneBot implementation.
 */
public final class OneBotEvent implements BotEvent {

    private final ObjectNode json;
    private final CorrelationKey correlationKey;

    private OneBotEvent(ObjectNode json, CorrelationKey correlationKey) {
        this.json = json;
        this.correlationKey = correlationKey;
    }

    public static OneBotEvent of(ObjectNode json) {
        return new OneBotEvent(json, correlationKeyOf(json));
    }

    /**
     * An {@code echo} string wins over subject ids: API replies can carry
     * {@code group_id} inside their payload, but they only ever answer the
     * call that chose the token.
     */
    static CorrelationKey correlationKeyOf(ObjectNode json) {
        JsonNode echo = json.get("echo");
        if (echo != null && echo.isTextual()) {
            return new CorrelationKey.Echo(echo.asText());
        }
        Long groupId = longField(json, "group_id");
        Long userId = longField(json, "user_id");
        if (groupId != null || userId != null) {
            return new CorrelationKey.Subject(groupId, userId);
        }
        return new CorrelationKey.None();
    }

    public ObjectNode json() {
        return json;
    }

    public CorrelationKey correlationKey() {
        return correlationKey;
    }

    public Optional<String> postType() {
        return Optional.ofNullable(text(json, "post_type"));
    }

    public Optional<String> echo() {
        return Optional.ofNullable(text(json, "echo"));
    }

    /** Numeric {@code group_id}, empty when absent or not a JSON integer. */
    public Optional<Long> groupId() {
        return Optional.ofNullable(longField(json, "group_id"));
    }

    /** Message view, present only for {@code post_type == "message"}. */
    public Optional<MessageEvent> asMessage() {
        if ("message".equals(text(json, "post_type"))) {
            return Optional.of(new MessageEvent(json));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return json.toString();
    }

    /** Ids are JSON integers on the wire; any other shape reads as absent. */
    static Long longField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() ? value.asLong() : null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
