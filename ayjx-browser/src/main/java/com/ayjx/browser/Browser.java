package com.ayjx.browser;

import com.ayjx.common.infra.Json;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * A running browser: its process (when launched locally) plus the DevTools
 * transport connected to it.
 */
@Slf4j
public class Browser implements AutoCloseable {

    private static final double MIN_CAPTURE_HEIGHT = 100;

    private final CdpTransport transport;
    private final BrowserProcess process;

    /**
     * @param process may be null when the browser is not owned by us
     */
    public Browser(CdpTransport transport, BrowserProcess process) {
        this.transport = transport;
        this.process = process;
    }

    public static Browser launch(boolean headless, String executable) throws CdpException, IOException {
        BrowserProcess process = BrowserProcess.launch(headless, executable);
        CdpTransport transport = connectOrRelease(process.getWebSocketUrl(), CdpTransport::connect, process::close);
        Browser browser = new Browser(transport, process);
        try {
            browser.closeInitialPage();
        } catch (RuntimeException e) {
            browser.close();
            throw e;
        }
        return browser;
    }

    @FunctionalInterface
    interface Connector {
        CdpTransport connect(String wsUrl) throws CdpException;
    }

    /** Connect to {@code wsUrl}; on any failure run {@code release} before rethrowing. */
    static CdpTransport connectOrRelease(String wsUrl, Connector connector, Runnable release) throws CdpException {
        try {
            return connector.connect(wsUrl);
        } catch (CdpException | RuntimeException e) {
            release.run();
            throw e;
        }
    }

    public CdpTransport getTransport() {
        return transport;
    }

    public Tab newTab() throws CdpException {
        return Tab.create(transport);
    }

    /** Whether the browser still answers {@code Target.getTargets}. */
    public boolean isAlive() {
        try {
            transport.call("Target.getTargets", Json.object());
            return true;
        } catch (CdpException e) {
            log.debug("[browser] liveness check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Render {@code html} in a fresh tab and capture the first element
     * matching {@code selector}.
     *
     * @return base64-encoded image
     */
    public String captureHtml(String html, String selector, CaptureOptions options) throws CdpException {
        Tab tab = newTab();
        try {
            if (options.getViewport() != null) {
                tab.setViewport(options.getViewport());
            }
            tab.setContent(html);
            return tab.findElement(selector).screenshot(options);
        } finally {
            closeQuietly(tab);
        }
    }

    public String captureHtmlHidpi(String html, String selector, double scale) throws CdpException {
        CaptureOptions options = CaptureOptions.builder()
                .viewport(Viewport.defaults().withDeviceScaleFactor(scale))
                .build();
        return captureHtml(html, selector, options);
    }

    /**
     * Load {@code url} in a fresh tab and capture it from the top, at most
     * {@code maxHeight} CSS pixels tall and no less than 100.
     *
     * @return base64-encoded image
     */
    public String captureUrl(String url, Viewport viewport, int maxHeight, CaptureOptions options)
            throws CdpException {
        Tab tab = newTab();
        try {
            tab.setViewport(viewport);
            tab.navigate(url);
            double height = Math.max(Math.min(tab.contentHeight(), maxHeight), MIN_CAPTURE_HEIGHT);
            CaptureOptions clipped = options.toBuilder()
                    .viewport(null)
                    .fullPage(true)
                    .clip(new ClipRegion(0, 0, viewport.width(), height, 1.0))
                    .build();
            return tab.screenshot(clipped);
        } finally {
            closeQuietly(tab);
        }
    }

    @Override
    public void close() {
        transport.shutdown();
        if (process != null) {
            process.close();
        }
    }

    /** A fresh browser opens one blank page; tabs are created on demand. */
    private void closeInitialPage() {
        try {
            JsonNode targets = transport.call("Target.getTargets", Json.object()).path("targetInfos");
            for (JsonNode target : targets) {
                if ("page".equals(target.path("type").asText())) {
                    transport.call("Target.closeTarget",
                            Json.object().put("targetId", target.path("targetId").asText()));
                    return;
                }
            }
        } catch (CdpException e) {
            log.debug("[browser] could not close initial page: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Tab tab) {
        try {
            tab.close();
        } catch (CdpException e) {
            log.debug("[browser] tab close failed: {}", e.getMessage());
        }
    }
}
