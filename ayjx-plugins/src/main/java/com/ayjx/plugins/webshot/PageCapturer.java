package com.ayjx.plugins.webshot;

/**
 * Renders a URL to an image.
 */
@FunctionalInterface
public interface PageCapturer {

    /**
     * @return base64-encoded image
     */
    String capture(String url, WebShotConfig config) throws Exception;
}
