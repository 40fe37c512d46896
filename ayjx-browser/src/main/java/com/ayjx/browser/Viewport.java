package com.ayjx.browser;

/**
 * Page size and device emulation applied through
 * {@code Emulation.setDeviceMetricsOverride}.
 */
public record Viewport(int width, int height, double deviceScaleFactor, boolean mobile, boolean hasTouch,
                       boolean landscape) {

    public static Viewport defaults() {
        return new Viewport(800, 600, 1.0, false, false, false);
    }

    public static Viewport of(int width, int height) {
        return new Viewport(width, height, 1.0, false, false, false);
    }

    public Viewport withDeviceScaleFactor(double factor) {
        return new Viewport(width, height, factor, mobile, hasTouch, landscape);
    }

    public Viewport withHeight(int newHeight) {
        return new Viewport(width, newHeight, deviceScaleFactor, mobile, hasTouch, landscape);
    }
}
