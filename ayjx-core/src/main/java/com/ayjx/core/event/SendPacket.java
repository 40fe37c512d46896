package com.ayjx.core.event;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An outgoing action travelling through the pipeline before it is written,
 * so plugins can inspect, rewrite or veto it.
 */
public final class SendPacket implements BotEvent {

    private final String action;
    private final ObjectNode params;
    private final OneBotEvent originalEvent;

    public SendPacket(String action, ObjectNode params, OneBotEvent originalEvent) {
        this.action = action;
        this.params = params;
        this.originalEvent = originalEvent;
    }

    public String action() {
        return action;
    }

    public ObjectNode params() {
        return params;
    }

    /** The inbound event that triggered this send, if any. Never serialised. */
    public OneBotEvent originalEvent() {
        return originalEvent;
    }

    /** Target group id, or null for private sends. */
    public Long groupId() {
        return OneBotEvent.longField(params, "group_id");
    }

    public JsonNode message() {
        return params.get("message");
    }

    public String messageType() {
        return OneBotEvent.text(params, "message_type");
    }

    /** Wire form {@code {action, params}}. */
    public ObjectNode toFrame() {
        ObjectNode frame = Json.object();
        frame.put("action", action);
        frame.set("params", params);
        return frame;
    }

    @Override
    public String toString() {
        return toFrame().toString();
    }
}
