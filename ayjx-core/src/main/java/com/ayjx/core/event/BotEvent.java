package com.ayjx.core.event;

/**
 * What a {@link com.ayjx.core.BotContext} is currently carrying through the
 * pipeline: an inbound platform event, an outgoing packet about to be sent,
 * or the one-off startup marker.
 */
public sealed interface BotEvent permits OneBotEvent, SendPacket, StartupEvent {
}
