package com.ayjx.browser;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DevTools protocol client built as a single-owner actor.
 * <p>
 * One thread owns the socket's write side and both correlation tables
 * (pending replies by id, event listeners by session and method). Callers
 * and the socket listener only talk to it through a mailbox, so the tables
 * need no locking. Replies arrive either directly, keyed by the outer
 * command id, or wrapped in a {@code Target.receivedMessageFromTarget}
 * envelope whose {@code message} string is decoded again and keyed by the
 * inner id.
 * <p>
 * The actor itself applies no per-call timeout; the blocking helpers race
 * each reply against a deadline on the caller's side.
 */
@Slf4j
public class CdpTransport implements AutoCloseable {

    static final String DROPPED = "Transport actor dropped";

    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);
    private static final long HANDSHAKE_TIMEOUT_MS = 5_000;
    private static final long STOP_GRACE_MS = 2_000;
    private static final AtomicLong ID_COUNTER = new AtomicLong();

    private record EventKey(String sessionId, String method) {
    }

    private final BlockingQueue<TransportMessage> inbox = new LinkedBlockingQueue<>();
    private final Object lifecycle = new Object();
    private final Duration callTimeout;
    private WebSocket socket;
    private Thread actor;
    private boolean accepting = true;

    // owned by the actor thread
    private final Map<Long, CompletableFuture<TransportResponse>> pending = new HashMap<>();
    private final Map<EventKey, List<CompletableFuture<Void>>> listeners = new HashMap<>();

    private CdpTransport(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    /** Next command id. Ids are unique across all transports and sessions. */
    public static long nextId() {
        return ID_COUNTER.incrementAndGet();
    }

    /** {@code {id, method, params}} with a fresh id. */
    public static ObjectNode command(String method, JsonNode params) {
        ObjectNode command = Json.object();
        command.put("id", nextId());
        command.put("method", method);
        command.set("params", params == null ? Json.object() : params);
        return command;
    }

    public static CdpTransport connect(String wsUrl) throws CdpException {
        OkHttpClient client = new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build();
        return connect(wsUrl, client, DEFAULT_CALL_TIMEOUT);
    }

    /**
     * Open the socket and start the actor.
     *
     * @param callTimeout deadline the blocking helpers wait for each reply
     */
    public static CdpTransport connect(String wsUrl, OkHttpClient client, Duration callTimeout)
            throws CdpException {
        CdpTransport transport = new CdpTransport(callTimeout);
        CountDownLatch opened = new CountDownLatch(1);
        AtomicReference<Throwable> handshakeError = new AtomicReference<>();

        WebSocket ws = client.newWebSocket(new Request.Builder().url(wsUrl).build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                opened.countDown();
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                transport.inbox.offer(new TransportMessage.Incoming(text));
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(1000, null);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                transport.inbox.offer(new TransportMessage.SocketClosed("closed: " + code + " " + reason));
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                if (opened.getCount() > 0) {
                    handshakeError.set(t);
                    opened.countDown();
                }
                transport.inbox.offer(new TransportMessage.SocketClosed("failure: " + t.getMessage()));
            }
        });

        try {
            if (!opened.await(HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                ws.cancel();
                throw new CdpException("CDP WebSocket handshake timeout");
            }
        } catch (InterruptedException e) {
            ws.cancel();
            Thread.currentThread().interrupt();
            throw new CdpException("CDP connection interrupted", e);
        }
        if (handshakeError.get() != null) {
            throw new CdpException("CDP connection failed: " + handshakeError.get().getMessage(),
                    handshakeError.get());
        }

        transport.socket = ws;
        transport.actor = new Thread(transport::run, "cdp-transport");
        transport.actor.setDaemon(true);
        transport.actor.start();
        log.debug("[cdp] connected to {}", wsUrl);
        return transport;
    }

    // =========================================================================
    // Caller API
    // =========================================================================

    /** Send a browser-level command and wait for the reply with the same id. */
    public TransportResponse send(ObjectNode command) throws CdpException {
        CompletableFuture<TransportResponse> reply = new CompletableFuture<>();
        post(new TransportMessage.Request(command, reply));
        try {
            return await(reply, "response to " + command.path("method").asText());
        } finally {
            if (!reply.isDone()) {
                forget(command.path("id").asLong(-1));
            }
        }
    }

    /**
     * Send {@code method} and return its {@code result}.
     *
     * @throws CdpException also when the reply carries an {@code error}
     */
    public JsonNode call(String method, JsonNode params) throws CdpException {
        return result(method, send(command(method, params)).body());
    }

    /**
     * Register interest in the session reply carrying inner id {@code id}.
     * Post this before the command that will cause the reply.
     */
    public CompletableFuture<TransportResponse> listenTargetMessage(long id) throws CdpException {
        CompletableFuture<TransportResponse> reply = new CompletableFuture<>();
        post(new TransportMessage.ListenTargetMessage(id, reply));
        return reply;
    }

    /**
     * Register interest in the next {@code method} event from a session. All
     * listeners registered for the pair fire on the first such event.
     */
    /**
     * Release the reply slot for {@code id} after its caller gave up. The
     * slot's future is cancelled. No-op once the actor has stopped.
     */
    void forget(long id) {
        synchronized (lifecycle) {
            if (accepting) {
                inbox.offer(new TransportMessage.Forget(id));
            }
        }
    }

    /** Number of reply slots the actor still holds. */
    int pendingCount() throws CdpException {
        CompletableFuture<Integer> count = new CompletableFuture<>();
        post(new TransportMessage.PendingCount(count));
        return await(count, "pending count");
    }

    public CompletableFuture<Void> expectEvent(String sessionId, String method) throws CdpException {
        CompletableFuture<Void> fired = new CompletableFuture<>();
        post(new TransportMessage.WaitForEvent(sessionId, method, fired));
        return fired;
    }

    public void waitForEvent(String sessionId, String method) throws CdpException {
        await(expectEvent(sessionId, method), "event " + method);
    }

    /** Block on a reply future with the call deadline. */
    public <T> T await(CompletableFuture<T> future, String what) throws CdpException {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CdpException("Timeout waiting for " + what);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CdpException ce) {
                throw ce;
            }
            throw new CdpException("CDP call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CdpException("Interrupted waiting for " + what, e);
        }
    }

    public boolean isRunning() {
        synchronized (lifecycle) {
            return accepting;
        }
    }

    /**
     * Ask the browser to close, close the socket and stop the actor. Later
     * calls fail with "Transport actor dropped". Idempotent.
     */
    public void shutdown() {
        synchronized (lifecycle) {
            if (!accepting) {
                return;
            }
            inbox.offer(new TransportMessage.Shutdown());
        }
        try {
            actor.join(STOP_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /** Extract {@code result}, turning a CDP {@code error} into an exception. */
    static JsonNode result(String method, JsonNode reply) throws CdpException {
        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            throw new CdpException(method + " failed: " + error.path("message").asText(error.toString()));
        }
        return reply.path("result");
    }

    private void post(TransportMessage message) throws CdpException {
        synchronized (lifecycle) {
            if (!accepting) {
                throw new CdpException(DROPPED);
            }
            inbox.offer(message);
        }
    }

    // =========================================================================
    // Actor
    // =========================================================================

    private void run() {
        try {
            while (true) {
                if (!handle(inbox.take())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            terminate();
        }
    }

    /** @return false when the actor should stop */
    private boolean handle(TransportMessage message) {
        if (message instanceof TransportMessage.Request request) {
            long id = request.command().path("id").asLong(-1);
            if (id < 0) {
                request.reply().completeExceptionally(new CdpException("command has no id"));
                return true;
            }
            pending.put(id, request.reply());
            if (!socket.send(Json.write(request.command()))) {
                pending.remove(id);
                request.reply().completeExceptionally(new CdpException("WebSocket send failed"));
            }
        } else if (message instanceof TransportMessage.ListenTargetMessage listen) {
            pending.put(listen.id(), listen.reply());
        } else if (message instanceof TransportMessage.Forget forget) {
            CompletableFuture<TransportResponse> abandoned = pending.remove(forget.id());
            if (abandoned != null) {
                abandoned.cancel(false);
            }
        } else if (message instanceof TransportMessage.PendingCount query) {
            query.reply().complete(pending.size());
        } else if (message instanceof TransportMessage.WaitForEvent wait) {
            listeners.computeIfAbsent(new EventKey(wait.sessionId(), wait.method()), k -> new ArrayList<>())
                    .add(wait.reply());
        } else if (message instanceof TransportMessage.Incoming incoming) {
            handleIncoming(incoming.text());
        } else if (message instanceof TransportMessage.SocketClosed closed) {
            log.warn("[cdp] socket {}", closed.reason());
            return false;
        } else if (message instanceof TransportMessage.Shutdown) {
            socket.send(Json.write(command("Browser.close", null)));
            socket.close(1000, "shutdown");
            return false;
        }
        return true;
    }

    private void handleIncoming(String text) {
        JsonNode frame;
        try {
            frame = Json.MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("[cdp] dropping malformed frame: {}", e.getOriginalMessage());
            return;
        }
        JsonNode id = frame.get("id");
        if (id != null && id.isIntegralNumber()) {
            CompletableFuture<TransportResponse> reply = pending.remove(id.asLong());
            if (reply != null) {
                reply.complete(new TransportResponse.Response(id.asLong(), frame));
            }
            return;
        }
        if (!"Target.receivedMessageFromTarget".equals(frame.path("method").asText())) {
            return;
        }
        JsonNode params = frame.path("params");
        JsonNode message = params.get("message");
        if (message == null || !message.isTextual()) {
            return;
        }
        JsonNode inner;
        try {
            inner = Json.MAPPER.readTree(message.asText());
        } catch (JsonProcessingException e) {
            log.debug("[cdp] dropping malformed target message: {}", e.getOriginalMessage());
            return;
        }
        handleTargetMessage(inner, params.path("sessionId").asText(null));
    }

    private void handleTargetMessage(JsonNode inner, String sessionId) {
        JsonNode id = inner.get("id");
        if (id != null && id.isIntegralNumber()) {
            CompletableFuture<TransportResponse> reply = pending.remove(id.asLong());
            if (reply != null) {
                reply.complete(new TransportResponse.Target(inner));
            }
            return;
        }
        JsonNode method = inner.get("method");
        if (method != null && method.isTextual() && sessionId != null) {
            List<CompletableFuture<Void>> waiting = listeners.remove(new EventKey(sessionId, method.asText()));
            if (waiting != null) {
                waiting.forEach(f -> f.complete(null));
            }
        }
    }

    private void terminate() {
        List<TransportMessage> leftovers = new ArrayList<>();
        synchronized (lifecycle) {
            accepting = false;
            inbox.drainTo(leftovers);
        }
        CdpException dropped = new CdpException(DROPPED);
        for (TransportMessage message : leftovers) {
            if (message instanceof TransportMessage.Request request) {
                request.reply().completeExceptionally(dropped);
            } else if (message instanceof TransportMessage.ListenTargetMessage listen) {
                listen.reply().completeExceptionally(dropped);
            } else if (message instanceof TransportMessage.WaitForEvent wait) {
                wait.reply().completeExceptionally(dropped);
            } else if (message instanceof TransportMessage.PendingCount query) {
                query.reply().completeExceptionally(dropped);
            }
        }
        pending.values().forEach(f -> f.completeExceptionally(dropped));
        pending.clear();
        listeners.values().forEach(list -> list.forEach(f -> f.completeExceptionally(dropped)));
        listeners.clear();
        log.debug("[cdp] transport stopped");
    }
}
