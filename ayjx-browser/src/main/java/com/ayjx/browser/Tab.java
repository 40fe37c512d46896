package com.ayjx.browser;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * One page target attached through a session. Page-level commands travel
 * inside {@code Target.sendMessageToTarget}; their replies come back
 * wrapped and are matched by the inner command id.
 */
public class Tab {

    private final CdpTransport transport;
    private final String targetId;
    private final String sessionId;

    Tab(CdpTransport transport, String targetId, String sessionId) {
        this.transport = transport;
        this.targetId = targetId;
        this.sessionId = sessionId;
    }

    /** Open {@code about:blank} in a new target and attach to it. */
    public static Tab create(CdpTransport transport) throws CdpException {
        JsonNode created = transport.call("Target.createTarget", Json.object().put("url", "about:blank"));
        String targetId = created.path("targetId").asText(null);
        if (targetId == null) {
            throw new CdpException("Target.createTarget returned no targetId");
        }
        JsonNode attached = transport.call("Target.attachToTarget", Json.object().put("targetId", targetId));
        String sessionId = attached.path("sessionId").asText(null);
        if (sessionId == null) {
            throw new CdpException("Target.attachToTarget returned no sessionId");
        }
        return new Tab(transport, targetId, sessionId);
    }

    public String getTargetId() {
        return targetId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Run a page-level command in this tab's session.
     *
     * @return the command's {@code result}
     */
    public JsonNode sendCmd(String method, JsonNode params) throws CdpException {
        ObjectNode inner = CdpTransport.command(method, params);
        return CdpTransport.result(method, sendAndGetMessage(inner.get("id").asLong(), Json.write(inner)));
    }

    /**
     * Forward an encoded inner command and wait for the wrapped reply. The
     * listener for the inner id is registered before the envelope is sent
     * and released again if no reply is taken.
     */
    JsonNode sendAndGetMessage(long innerId, String message) throws CdpException {
        CompletableFuture<TransportResponse> reply = transport.listenTargetMessage(innerId);
        ObjectNode params = Json.object()
                .put("sessionId", sessionId)
                .put("message", message);
        TransportResponse response;
        try {
            transport.call("Target.sendMessageToTarget", params);
            response = transport.await(reply, "target message " + innerId);
        } finally {
            if (!reply.isDone()) {
                transport.forget(innerId);
            }
        }
        if (!(response instanceof TransportResponse.Target target)) {
            throw new CdpException("Unexpected response: " + response);
        }
        return target.body();
    }

    public Tab setViewport(Viewport viewport) throws CdpException {
        ObjectNode orientation = viewport.landscape()
                ? Json.object().put("type", "landscapePrimary").put("angle", 90)
                : Json.object().put("type", "portraitPrimary").put("angle", 0);
        ObjectNode params = Json.object()
                .put("width", viewport.width())
                .put("height", viewport.height())
                .put("deviceScaleFactor", viewport.deviceScaleFactor())
                .put("mobile", viewport.mobile());
        params.set("screenOrientation", orientation);
        sendCmd("Emulation.setDeviceMetricsOverride", params);
        if (viewport.hasTouch()) {
            sendCmd("Emulation.setTouchEmulationEnabled", Json.object().put("enabled", true).put("maxTouchPoints", 5));
        }
        return this;
    }

    /** Replace the document with {@code html} and wait for its load event. */
    public Tab setContent(String html) throws CdpException {
        sendCmd("Page.enable", Json.object());
        CompletableFuture<Void> loaded = transport.expectEvent(sessionId, "Page.loadEventFired");
        String script;
        try {
            script = "document.open(); document.write(" + Json.MAPPER.writeValueAsString(html)
                    + "); document.close();";
        } catch (JsonProcessingException e) {
            throw new CdpException("cannot encode page content", e);
        }
        sendCmd("Runtime.evaluate", Json.object().put("expression", script).put("awaitPromise", true));
        transport.await(loaded, "Page.loadEventFired");
        return this;
    }

    /** Load {@code url} and wait for its load event. */
    public Tab navigate(String url) throws CdpException {
        sendCmd("Page.enable", Json.object());
        CompletableFuture<Void> loaded = transport.expectEvent(sessionId, "Page.loadEventFired");
        JsonNode result = sendCmd("Page.navigate", Json.object().put("url", url));
        String errorText = result.path("errorText").asText("");
        if (!errorText.isEmpty()) {
            throw new CdpException("navigation to " + url + " failed: " + errorText);
        }
        transport.await(loaded, "Page.loadEventFired");
        return this;
    }

    /** Evaluate a script and return its value ({@code returnByValue}). */
    public JsonNode evaluate(String expression) throws CdpException {
        JsonNode result = sendCmd("Runtime.evaluate", Json.object()
                .put("expression", expression)
                .put("returnByValue", true)
                .put("awaitPromise", true));
        JsonNode exception = result.get("exceptionDetails");
        if (exception != null) {
            throw new CdpException("script failed: " + exception.path("text").asText());
        }
        return result.path("result").path("value");
    }

    /** Full document height in CSS pixels. */
    public double contentHeight() throws CdpException {
        JsonNode metrics = sendCmd("Page.getLayoutMetrics", Json.object());
        JsonNode size = metrics.has("cssContentSize") ? metrics.get("cssContentSize") : metrics.path("contentSize");
        return size.path("height").asDouble(0);
    }

    public Element findElement(String selector) throws CdpException {
        JsonNode document = sendCmd("DOM.getDocument", Json.object());
        JsonNode rootId = document.path("root").path("nodeId");
        if (!rootId.isIntegralNumber()) {
            throw new CdpException("No root node");
        }
        JsonNode found = sendCmd("DOM.querySelector", Json.object()
                .put("nodeId", rootId.asLong())
                .put("selector", selector));
        long nodeId = found.path("nodeId").asLong(0);
        if (nodeId == 0) {
            throw new CdpException("Element not found: " + selector);
        }
        return Element.describe(this, nodeId);
    }

    /**
     * Capture the page, or the options' clip region.
     *
     * @return base64-encoded image
     */
    public String screenshot(CaptureOptions options) throws CdpException {
        if (options.getViewport() != null) {
            setViewport(options.getViewport());
        }
        ObjectNode params = screenshotParams(options);
        ClipRegion clip = options.getClip();
        if (clip != null) {
            params.set("clip", clipNode(clip));
        }
        return capture(params);
    }

    public Tab activate() throws CdpException {
        transport.call("Target.activateTarget", Json.object().put("targetId", targetId));
        return this;
    }

    public void close() throws CdpException {
        transport.call("Target.closeTarget", Json.object().put("targetId", targetId));
    }

    static ObjectNode screenshotParams(CaptureOptions options) {
        ObjectNode params = Json.object()
                .put("format", options.getFormat().wireName())
                .put("fromSurface", true)
                .put("captureBeyondViewport", options.isFullPage());
        if (options.getFormat().lossy()) {
            params.put("quality", options.effectiveQuality());
        }
        return params;
    }

    static ObjectNode clipNode(ClipRegion clip) {
        return Json.object()
                .put("x", clip.x())
                .put("y", clip.y())
                .put("width", clip.width())
                .put("height", clip.height())
                .put("scale", clip.scale());
    }

    String capture(ObjectNode params) throws CdpException {
        JsonNode data = sendCmd("Page.captureScreenshot", params).get("data");
        if (data == null || !data.isTextual()) {
            throw new CdpException("No image data received");
        }
        return data.asText();
    }
}
