package com.ayjx.plugins.webshot;

import com.ayjx.browser.Browser;
import com.ayjx.browser.CaptureOptions;
import com.ayjx.browser.CdpException;
import com.ayjx.browser.ImageFormat;
import com.ayjx.browser.SharedBrowser;
import com.ayjx.browser.Viewport;

/**
 * Captures through the process-wide {@link SharedBrowser}, in a fresh tab
 * per URL.
 */
public class BrowserPageCapturer implements PageCapturer {

    private static final int INITIAL_VIEWPORT_HEIGHT = 800;

    private final SharedBrowser browser;

    public BrowserPageCapturer(SharedBrowser browser) {
        this.browser = browser;
    }

    @Override
    public String capture(String url, WebShotConfig config) throws CdpException {
        Browser instance = browser.instance();
        Viewport viewport = Viewport.of(config.getViewportWidth(), INITIAL_VIEWPORT_HEIGHT)
                .withDeviceScaleFactor(config.getDeviceScaleFactor());
        return instance.captureUrl(url, viewport, config.getMaxHeight(), options(config));
    }

    static CaptureOptions options(WebShotConfig config) {
        if (config.getQuality() >= 100) {
            return CaptureOptions.builder().format(ImageFormat.PNG).build();
        }
        return CaptureOptions.builder()
                .format(ImageFormat.JPEG)
                .quality(Math.max(config.getQuality(), 0))
                .build();
    }
}
