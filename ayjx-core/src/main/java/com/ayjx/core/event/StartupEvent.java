package com.ayjx.core.event;

/** Carried by the context handed to plugin init hooks. */
public enum StartupEvent implements BotEvent {
    INSTANCE
}
