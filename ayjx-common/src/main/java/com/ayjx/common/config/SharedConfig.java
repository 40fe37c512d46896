package com.ayjx.common.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Live, process-wide configuration shared by every connection and plugin.
 * <p>
 * Reads take the read lock. Mutations take the write lock, release it, and
 * then persist a deep snapshot under a separate save lock so that two
 * writers never interleave partial writes to the file. Persistence is best
 * effort: failures are logged and the in-memory state stays authoritative.
 */
@Slf4j
public class SharedConfig {

    private final ConfigService configService;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private AyjxConfig current;

    public SharedConfig(ConfigService configService) {
        this.configService = configService;
        this.mapper = configService.getObjectMapper();
        this.current = configService.copy(configService.loadConfig());
    }

    /**
     * Run a read-only view function under the read lock. The function must
     * not retain references to mutable parts of the config.
     */
    public <T> T read(Function<AyjxConfig, T> view) {
        lock.readLock().lock();
        try {
            return view.apply(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Deep copy of the current config. */
    public AyjxConfig snapshot() {
        return read(configService::copy);
    }

    /**
     * Mutate the config under the write lock, then persist.
     *
     * @return whether the change reached disk
     */
    public boolean update(Consumer<AyjxConfig> mutator) {
        lock.writeLock().lock();
        try {
            mutator.accept(current);
        } finally {
            lock.writeLock().unlock();
        }
        return persist();
    }

    /**
     * Snapshot and save the current config. Errors are logged, not thrown.
     */
    public boolean persist() {
        saveLock.lock();
        try {
            AyjxConfig snapshot = snapshot();
            configService.saveConfig(snapshot);
            return true;
        } catch (IOException e) {
            log.error("[config] failed to save {}: {}", configService.getConfigPath(), e.getMessage());
            return false;
        } finally {
            saveLock.unlock();
        }
    }

    /** Re-read the file from disk and replace the live config. */
    public void reload() {
        AyjxConfig fresh = configService.copy(configService.reloadConfig());
        lock.writeLock().lock();
        try {
            current = fresh;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[config] reloaded from {}", configService.getConfigPath());
    }

    public List<String> commandPrefixes() {
        return read(c -> List.copyOf(c.getCommandPrefixes()));
    }

    public boolean allowsGroup(long groupId) {
        return read(c -> c.getGlobalFilter().allows(groupId));
    }

    public boolean isPluginEnabled(String name) {
        return read(c -> isEnabled(c.getPlugins().get(name)));
    }

    /** Names of every plugin whose block has {@code enabled: true}. */
    public Set<String> enabledPlugins() {
        return read(c -> {
            Set<String> names = new LinkedHashSet<>();
            for (Map.Entry<String, ObjectNode> entry : c.getPlugins().entrySet()) {
                if (isEnabled(entry.getValue())) {
                    names.add(entry.getKey());
                }
            }
            return names;
        });
    }

    /** Flip a plugin's enable flag and persist. */
    public boolean setPluginEnabled(String name, boolean enabled) {
        return update(c -> c.getPlugins()
                .computeIfAbsent(name, k -> mapper.createObjectNode())
                .put("enabled", enabled));
    }

    /**
     * Typed view of a plugin's block. A missing block yields the type's
     * defaults; unknown fields are ignored.
     */
    public <T> T pluginConfig(String name, Class<T> type) {
        JsonNode node = read(c -> {
            ObjectNode block = c.getPlugins().get(name);
            return block == null ? mapper.createObjectNode() : block.deepCopy();
        });
        return mapper.convertValue(node, type);
    }

    /**
     * Read-modify-write of a plugin block through its typed form. Fields of
     * the block unknown to {@code type} are kept.
     */
    public <T> boolean updatePluginConfig(String name, Class<T> type, Consumer<T> change) {
        return update(c -> {
            ObjectNode block = c.getPlugins().computeIfAbsent(name, k -> mapper.createObjectNode());
            T typed = mapper.convertValue(block, type);
            change.accept(typed);
            ObjectNode changed = mapper.valueToTree(typed);
            block.setAll(changed);
        });
    }

    /**
     * Merge each plugin's default block into the config. Missing blocks are
     * inserted whole; existing blocks only gain the keys they lack. Saves once
     * if anything changed.
     */
    public void ensurePluginDefaults(Map<String, ObjectNode> defaults) {
        boolean changed;
        lock.writeLock().lock();
        try {
            changed = false;
            for (Map.Entry<String, ObjectNode> entry : defaults.entrySet()) {
                ObjectNode existing = current.getPlugins().get(entry.getKey());
                if (existing == null) {
                    current.getPlugins().put(entry.getKey(), entry.getValue().deepCopy());
                    changed = true;
                    continue;
                }
                Iterator<Map.Entry<String, JsonNode>> fields = entry.getValue().fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!existing.has(field.getKey())) {
                        existing.set(field.getKey(), field.getValue().deepCopy());
                        changed = true;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (changed) {
            log.info("[config] added default plugin settings");
            persist();
        }
    }

    private static boolean isEnabled(ObjectNode block) {
        return block != null && block.path("enabled").asBoolean(false);
    }
}
