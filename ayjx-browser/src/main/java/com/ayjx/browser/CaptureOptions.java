package com.ayjx.browser;

import lombok.Builder;
import lombok.Getter;

/**
 * Screenshot settings.
 */
@Getter
@Builder(toBuilder = true)
public class CaptureOptions {

    @Builder.Default
    private final ImageFormat format = ImageFormat.JPEG;
    /** 0-100, lossy formats only; 90 when unset. */
    private final Integer quality;
    /** Applied to the tab before capturing when set. */
    private final Viewport viewport;
    private final boolean fullPage;
    /** Transparent background, PNG only. */
    private final boolean omitBackground;
    /** Explicit page region; page screenshots capture the viewport when unset. */
    private final ClipRegion clip;

    public static CaptureOptions defaults() {
        return builder().build();
    }

    /** Defaults at twice the device pixel ratio. */
    public static CaptureOptions hidpi() {
        return builder().viewport(Viewport.defaults().withDeviceScaleFactor(2.0)).build();
    }

    int effectiveQuality() {
        if (quality == null) {
            return 90;
        }
        return Math.max(0, Math.min(100, quality));
    }
}
