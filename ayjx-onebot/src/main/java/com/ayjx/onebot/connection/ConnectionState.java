package com.ayjx.onebot.connection;

/** Lifecycle of a {@link OneBotConnection}. */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
