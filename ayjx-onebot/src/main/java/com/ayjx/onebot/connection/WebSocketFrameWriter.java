package com.ayjx.onebot.connection;

import com.ayjx.core.FrameWriter;
import okhttp3.WebSocket;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single writer of one OneBot socket.
 */
public class WebSocketFrameWriter implements FrameWriter {

    private final WebSocket socket;
    private final ReentrantLock lock = new ReentrantLock();

    public WebSocketFrameWriter(WebSocket socket) {
        this.socket = socket;
    }

    @Override
    public void send(String frame) throws IOException {
        lock.lock();
        try {
            if (!socket.send(frame)) {
                throw new IOException("websocket is closing or its send buffer is full");
            }
        } finally {
            lock.unlock();
        }
    }
}
