package com.ayjx.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, caches and persists the bot configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AyjxConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public AyjxConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AyjxConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the whole config to disk. The file is written to a sibling temp
     * file first and moved into place so readers never see a partial write.
     */
    public void saveConfig(AyjxConfig config) throws IOException {
        Path dir = configPath.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        String json = objectMapper.writeValueAsString(config) + "\n";
        Path tmp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(tmp, json);
        Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    /**
     * Deep copy through the JSON tree, used for snapshots handed to the
     * persistence path.
     */
    public AyjxConfig copy(AyjxConfig config) {
        return objectMapper.convertValue(objectMapper.valueToTree(config), AyjxConfig.class);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private AyjxConfig doLoadConfig() {
        try {
            AyjxConfig config;
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                config = applyDefaults(new AyjxConfig());
            } else {
                String raw = Files.readString(configPath);
                raw = substituteEnvVars(raw, System.getenv());
                config = applyDefaults(objectMapper.readValue(raw, AyjxConfig.class));
                log.info("Config loaded from: {}", configPath);
            }
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new AyjxConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw, Map<String, String> env) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    AyjxConfig applyDefaults(AyjxConfig config) {
        if (config.getCommandPrefixes() == null || config.getCommandPrefixes().isEmpty()) {
            config.setCommandPrefixes(new ArrayList<>(List.of("/")));
        }
        if (config.getBots() == null) {
            config.setBots(new ArrayList<>(List.of(new AyjxConfig.BotEndpointConfig())));
        }
        if (config.getGlobalFilter() == null) {
            config.setGlobalFilter(new AyjxConfig.GlobalFilterConfig());
        }
        if (config.getPush() == null) {
            config.setPush(new AyjxConfig.PushConfig());
        }
        if (config.getBrowser() == null) {
            config.setBrowser(new AyjxConfig.BrowserConfig());
        }
        if (config.getPlugins() == null) {
            config.setPlugins(new LinkedHashMap<>());
        }
        return config;
    }
}
