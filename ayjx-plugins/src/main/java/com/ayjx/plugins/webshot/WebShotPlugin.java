package com.ayjx.plugins.webshot;

import com.ayjx.common.infra.Json;
import com.ayjx.common.infra.NamedThreads;
import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.MessageEvent;
import com.ayjx.core.pipeline.BotPlugin;
import com.ayjx.onebot.api.OneBotApi;
import com.ayjx.onebot.message.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replies to messages containing a web link with a screenshot of the page.
 * The event always continues down the chain; capture failures are only
 * logged. Captures run on the plugin's own pool, stopped by {@link #shutdown()}.
 */
@Slf4j
public class WebShotPlugin implements BotPlugin {

    public static final String NAME = "web_shot";

    /** Stops at whitespace and CJK ideographs, which commonly follow a pasted link. */
    private static final Pattern URL = Pattern.compile("https?://[^\\s\\u4e00-\\u9fa5]+");

    private final PageCapturer capturer;
    private final ExecutorService captures = Executors.newCachedThreadPool(NamedThreads.daemon("web-shot"));

    public WebShotPlugin(PageCapturer capturer) {
        this.capturer = capturer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode defaultConfig() {
        return Json.MAPPER.valueToTree(new WebShotConfig());
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception {
        Optional<MessageEvent> message = ctx.asMessage();
        if (message.isEmpty()) {
            return Optional.of(ctx);
        }
        MessageEvent msg = message.get();
        WebShotConfig config = ctx.getConfig().pluginConfig(NAME, WebShotConfig.class);
        if (!shouldProcess(msg.groupId(), config.getChannel())) {
            return Optional.of(ctx);
        }
        String selfId = ctx.getBot().loginUser().id();
        if (!selfId.isEmpty() && selfId.equals(String.valueOf(msg.userId()))) {
            return Optional.of(ctx);
        }
        if (config.isOnlyAt() && !startsWithAt(msg.segments(), selfId)) {
            return Optional.of(ctx);
        }
        String text = msg.text().isEmpty() ? Message.plainText(msg.segments()) : msg.text();
        Optional<String> url = extractUrl(text);
        if (url.isEmpty() || isIgnored(url.get(), config)) {
            return Optional.of(ctx);
        }

        log.info("[web_shot] capturing {}", url.get());
        Optional<String> image = captureWithTimeout(url.get(), config);
        if (image.isPresent()) {
            Message reply = Message.create().reply(msg.messageId()).imageBase64(image.get());
            OneBotApi.sendMsg(ctx, writer, msg.groupId(), msg.userId(), reply);
        }
        return Optional.of(ctx);
    }

    @Override
    public void shutdown() {
        captures.shutdownNow();
    }

    public boolean isShutdown() {
        return captures.isShutdown();
    }

    private Optional<String> captureWithTimeout(String url, WebShotConfig config) throws InterruptedException {
        Future<String> task;
        try {
            task = captures.submit(() -> capturer.capture(url, config));
        } catch (RejectedExecutionException e) {
            log.warn("[web_shot] shutting down, skipping {}", url);
            return Optional.empty();
        }
        try {
            return Optional.of(task.get(config.getTimeoutSeconds(), TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            task.cancel(true);
            log.error("[web_shot] page load timed out after {}s: {}", config.getTimeoutSeconds(), url);
        } catch (ExecutionException e) {
            log.error("[web_shot] capture failed for {}: {}", url, e.getCause().getMessage());
        }
        return Optional.empty();
    }

    /** Private chats always pass; groups go through the black list, then a non-empty white list. */
    static boolean shouldProcess(long groupId, WebShotConfig.ChannelFilter filter) {
        if (groupId == 0) {
            return true;
        }
        if (filter.getBlack().contains(groupId)) {
            return false;
        }
        return filter.getWhite().isEmpty() || filter.getWhite().contains(groupId);
    }

    static boolean startsWithAt(ArrayNode segments, String selfId) {
        if (segments.isEmpty() || selfId.isEmpty()) {
            return false;
        }
        JsonNode first = segments.get(0);
        return "at".equals(first.path("type").asText())
                && selfId.equals(first.path("data").path("qq").asText());
    }

    static Optional<String> extractUrl(String text) {
        Matcher matcher = URL.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    static boolean isIgnored(String url, WebShotConfig config) {
        return config.getIgnoreDomains().stream().anyMatch(url::contains);
    }
}
