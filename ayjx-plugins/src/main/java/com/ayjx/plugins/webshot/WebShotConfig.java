package com.ayjx.plugins.webshot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code plugins.web_shot} block.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebShotConfig {

    private boolean enabled = true;
    /** React only to messages that start by mentioning the bot. */
    private boolean onlyAt;
    private int maxHeight = 5000;
    private int timeoutSeconds = 30;
    /** JPEG quality; 100 or more switches to PNG. */
    private int quality = 80;
    private int viewportWidth = 1280;
    private double deviceScaleFactor = 1.0;
    /** URLs containing any of these are skipped. */
    private List<String> ignoreDomains = new ArrayList<>();
    private ChannelFilter channel = new ChannelFilter();

    /** Group white/black lists; private chats are always served. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelFilter {
        private List<Long> white = new ArrayList<>();
        private List<Long> black = new ArrayList<>();
    }
}
