package com.ayjx.browser;

public enum ImageFormat {
    JPEG("jpeg"),
    PNG("png"),
    WEBP("webp");

    private final String wireName;

    ImageFormat(String wireName) {
        this.wireName = wireName;
    }

    /** Value of {@code Page.captureScreenshot}'s {@code format}. */
    public String wireName() {
        return wireName;
    }

    /** Whether the format takes a {@code quality} parameter. */
    public boolean lossy() {
        return this != PNG;
    }
}
