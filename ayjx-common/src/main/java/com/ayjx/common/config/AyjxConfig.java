package com.ayjx.common.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root configuration type, loaded from {@code config.json}.
 */
@Data
public class AyjxConfig {

    /** Prefixes accepted in front of command names (e.g. "/" or "#"). */
    private List<String> commandPrefixes;

    /** One entry per OneBot implementation to connect to. */
    private List<BotEndpointConfig> bots;

    /** Group allow/block lists applied before the plugin pipeline. */
    private GlobalFilterConfig globalFilter;

    /** Daily broadcast settings. */
    private PushConfig push;

    /** Headless browser settings used by screenshot features. */
    private BrowserConfig browser;

    /**
     * Per-plugin configuration blocks keyed by plugin name. Each block carries
     * at least an {@code enabled} flag; a missing block means disabled.
     */
    private Map<String, ObjectNode> plugins;

    // --- Nested config types ---

    @Data
    public static class BotEndpointConfig {
        private String url = "ws://127.0.0.1:3001";
        /** Sent as {@code Authorization: Bearer <token>} when non-blank. */
        private String accessToken = "";
        private long reconnectDelayMs = 3000;
    }

    @Data
    public static class GlobalFilterConfig {
        private boolean enableWhitelist;
        private List<Long> whitelist = new ArrayList<>();
        private boolean enableBlacklist;
        private List<Long> blacklist = new ArrayList<>();

        /**
         * Whether events from the given group should reach the plugins.
         * An enabled allow-list decides alone; the block-list is only
         * consulted while the allow-list is disabled.
         */
        public boolean allows(long groupId) {
            if (enableWhitelist) {
                return whitelist != null && whitelist.contains(groupId);
            }
            if (enableBlacklist) {
                return blacklist == null || !blacklist.contains(groupId);
            }
            return true;
        }
    }

    @Data
    public static class PushConfig {
        /** Pause between two groups of one broadcast. */
        private long groupDelayMs = 2000;
    }

    @Data
    public static class BrowserConfig {
        private boolean headless = true;
        /** Explicit executable; falls back to the CHROME env var and PATH lookup. */
        private String executable;
    }
}
