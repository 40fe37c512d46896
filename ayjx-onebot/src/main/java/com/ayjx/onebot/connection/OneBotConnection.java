package com.ayjx.onebot.connection;

import com.ayjx.common.config.AyjxConfig;
import com.ayjx.common.infra.NamedThreads;
import com.ayjx.core.BotContext;
import com.ayjx.core.BotStatus;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.event.StartupEvent;
import com.ayjx.onebot.api.OneBotApi;
import com.ayjx.onebot.api.OneBotApiException;
import com.ayjx.onebot.api.OneBotTypes;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one forward WebSocket connection to a OneBot implementation alive.
 * <p>
 * A dedicated loop thread connects, serves the socket until it drops, waits
 * the configured flat delay and connects again, until {@link #close()}.
 * The correlator is supplied by the caller, who also closes it.
 * Frames are decoded on the socket's reader thread, in arrival order, and
 * each one is then processed on its own pooled task, so pipeline runs of
 * different frames overlap and may finish in any order.
 */
@Slf4j
public class OneBotConnection implements AutoCloseable {

    private static final long HANDSHAKE_TIMEOUT_MS = 30_000;
    private static final long STOP_GRACE_MS = 2_000;

    private final AyjxConfig.BotEndpointConfig endpoint;
    private final BotContext baseContext;
    private final Correlator correlator;
    private final OkHttpClient httpClient;
    private final ExecutorService frameExecutor;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger connectAttempts = new AtomicInteger();
    private final AtomicReference<BotStatus> botStatus = new AtomicReference<>(BotStatus.unknown("onebot", "qq"));

    private volatile WebSocket currentSocket;
    private volatile FrameWriter currentWriter;
    private Thread loopThread;

    public OneBotConnection(AyjxConfig.BotEndpointConfig endpoint, BotContext services, Correlator correlator) {
        this(endpoint, services, correlator, new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build());
    }

    /**
     * @param services   shared services (config, scheduler, pipeline, storage)
     * @param correlator reply/message waiter registry for this connection;
     *                   not closed by {@link #close()}
     */
    public OneBotConnection(AyjxConfig.BotEndpointConfig endpoint, BotContext services,
            Correlator correlator, OkHttpClient httpClient) {
        this.endpoint = endpoint;
        this.correlator = correlator;
        this.baseContext = services.toBuilder()
                .correlator(correlator)
                .event(StartupEvent.INSTANCE)
                .build();
        this.httpClient = httpClient;
        this.frameExecutor = Executors.newCachedThreadPool(NamedThreads.daemon("onebot-frame"));
    }

    /** Start the connect loop on its own thread. Idempotent. */
    public synchronized void start() {
        if (loopThread != null) {
            return;
        }
        loopThread = new Thread(this::runLoop, "onebot-loop-" + endpoint.getUrl());
        loopThread.setDaemon(true);
        loopThread.start();
    }

    public ConnectionState getState() {
        return state.get();
    }

    /** Number of connection attempts made so far, successful or not. */
    public int getConnectAttempts() {
        return connectAttempts.get();
    }

    public BotStatus getBotStatus() {
        return botStatus.get();
    }

    public Correlator getCorrelator() {
        return correlator;
    }

    /** Writer of the live socket, empty while disconnected. */
    public Optional<FrameWriter> getWriter() {
        return Optional.ofNullable(currentWriter);
    }

    public String getUrl() {
        return endpoint.getUrl();
    }

    // =========================================================================
    // Connect loop
    // =========================================================================

    private void runLoop() {
        long delay = endpoint.getReconnectDelayMs();
        while (!stopping.get()) {
            try {
                connectAndServe();
                if (stopping.get()) {
                    break;
                }
                log.warn("[onebot] {} disconnected, reconnecting in {}ms", endpoint.getUrl(), delay);
            } catch (IOException e) {
                log.error("[onebot] {} connect failed: {}. retrying in {}ms", endpoint.getUrl(), e.getMessage(), delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            state.set(ConnectionState.DISCONNECTED);
            if (awaitReconnectDelay(delay)) {
                break;
            }
        }
        state.set(ConnectionState.DISCONNECTED);
        log.info("[onebot] {} connection loop stopped", endpoint.getUrl());
    }

    /**
     * Wait out the reconnect delay, returning early when the connection is
     * closed.
     *
     * @return {@code true} if the loop should stop
     */
    private boolean awaitReconnectDelay(long delayMs) {
        try {
            return stopSignal.await(Math.max(delayMs, 0), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * One connection lifetime: handshake, then block until the socket is
     * closed or fails.
     *
     * @throws IOException if the handshake fails
     */
    private void connectAndServe() throws IOException, InterruptedException {
        state.set(ConnectionState.CONNECTING);
        connectAttempts.incrementAndGet();

        Request.Builder request = new Request.Builder().url(endpoint.getUrl());
        String token = endpoint.getAccessToken();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        SocketListener listener = new SocketListener();
        WebSocket socket = httpClient.newWebSocket(request.build(), listener);
        currentSocket = socket;
        try {
            if (!listener.opened.await(HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                socket.cancel();
                throw new IOException("handshake timed out");
            }
            Throwable handshakeError = listener.handshakeError.get();
            if (handshakeError != null) {
                throw new IOException(String.valueOf(handshakeError.getMessage()), handshakeError);
            }
            try {
                String reason = listener.closed.get();
                log.debug("[onebot] {} closed: {}", endpoint.getUrl(), reason);
            } catch (ExecutionException e) {
                log.warn("[onebot] {} socket error: {}", endpoint.getUrl(), e.getCause().getMessage());
            }
        } finally {
            currentSocket = null;
            currentWriter = null;
        }
    }

    private void fetchIdentity(FrameWriter writer) {
        BotContext ctx = baseContext.withBot(botStatus.get());
        OneBotTypes.LoginInfo info;
        try {
            info = OneBotApi.getLoginInfo(ctx, writer);
        } catch (OneBotApiException e) {
            log.warn("[onebot] failed to fetch login info: {}", e.getMessage());
            return;
        }
        if (info == null) {
            log.warn("[onebot] login info reply carried no data");
            return;
        }
        String id = String.valueOf(info.userId());
        BotStatus status = new BotStatus("onebot", "qq", new BotStatus.LoginUser(
                id, info.nickname(), info.nickname(), "https://q1.qlogo.cn/g?b=qq&nk=" + id + "&s=640"));
        botStatus.set(status);
        log.info("[onebot] logged in as {} ({})", info.nickname(), id);
        ctx.getPipeline().runConnected(ctx.withBot(status), writer);
    }

    private void submit(Runnable task) {
        try {
            frameExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("[onebot] dropping frame after shutdown");
        }
    }

    private final class SocketListener extends WebSocketListener {

        final CountDownLatch opened = new CountDownLatch(1);
        final CompletableFuture<String> closed = new CompletableFuture<>();
        final AtomicReference<Throwable> handshakeError = new AtomicReference<>();
        private volatile FrameWriter writer;

        @Override
        public void onOpen(WebSocket ws, Response response) {
            FrameWriter w = new WebSocketFrameWriter(ws);
            writer = w;
            currentWriter = w;
            state.set(ConnectionState.CONNECTED);
            log.info("[onebot] connected to {}", endpoint.getUrl());
            opened.countDown();
            submit(() -> fetchIdentity(w));
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            FrameWriter w = writer;
            FrameProcessor.decode(text).ifPresent(event -> {
                BotContext ctx = baseContext.withBot(botStatus.get());
                submit(() -> FrameProcessor.process(event, ctx, w));
            });
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            closed.complete("code=" + code + " reason=" + reason);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            if (opened.getCount() > 0) {
                handshakeError.set(t);
                opened.countDown();
            }
            closed.completeExceptionally(t);
        }
    }

    // =========================================================================
    // Shutdown
    // =========================================================================

    /**
     * Stop reconnecting and close the socket. Pending API waits are resolved
     * when the owner closes the correlator.
     */
    @Override
    public void close() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        stopSignal.countDown();
        WebSocket socket = currentSocket;
        if (socket != null) {
            socket.close(1000, "shutdown");
        }
        Thread loop;
        synchronized (this) {
            loop = loopThread;
        }
        if (loop != null) {
            try {
                loop.join(STOP_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            WebSocket stuck = currentSocket;
            if (loop.isAlive() && stuck != null) {
                stuck.cancel();
            }
        }
        frameExecutor.shutdownNow();
        log.info("[onebot] {} closed", endpoint.getUrl());
    }
}
