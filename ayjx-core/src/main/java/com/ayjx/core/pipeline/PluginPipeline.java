package com.ayjx.core.pipeline;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.BotEvent;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.event.SendPacket;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered chain of plugins that every unconsumed inbound event and every
 * outgoing packet passes through.
 * <p>
 * The chain is fixed when the pipeline is built. Which plugins take part is
 * read from the config once per run, so toggling a plugin takes effect on
 * the next event. Within one run plugins execute strictly in registration
 * order. Closing the pipeline shuts every plugin down, enabled or not.
 */
@Slf4j
public class PluginPipeline implements AutoCloseable {

    private final List<BotPlugin> plugins;

    private PluginPipeline(List<BotPlugin> plugins) {
        this.plugins = Collections.unmodifiableList(plugins);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<BotPlugin> plugins() {
        return plugins;
    }

    /** Default config block per plugin, in registration order. */
    public Map<String, ObjectNode> defaultConfigs() {
        Map<String, ObjectNode> defaults = new LinkedHashMap<>();
        for (BotPlugin plugin : plugins) {
            defaults.put(plugin.name(), plugin.defaultConfig());
        }
        return defaults;
    }

    /**
     * Run one context through the enabled plugins. When the context that
     * leaves the last plugin carries a {@link SendPacket}, the packet is
     * written as {@code {action, params}}.
     *
     * @throws PluginException if a handler fails; later plugins do not run
     * @throws IOException     if the final packet cannot be written
     */
    public void run(BotContext ctx, FrameWriter writer) throws PluginException, IOException {
        Set<String> enabled = ctx.getConfig().enabledPlugins();
        BotContext current = ctx;
        for (BotPlugin plugin : plugins) {
            if (!enabled.contains(plugin.name())) {
                continue;
            }
            Optional<BotContext> next;
            try {
                next = plugin.handle(current, writer);
            } catch (PluginException e) {
                throw e;
            } catch (Exception e) {
                throw new PluginException(plugin.name(), e);
            }
            if (next == null || next.isEmpty()) {
                log.trace("[plugin] {} stopped the chain", plugin.name());
                return;
            }
            current = next.get();
        }
        BotEvent event = current.getEvent();
        if (event instanceof SendPacket packet) {
            writer.send(packet.toFrame());
        }
    }

    /** Push an outgoing packet through the chain so plugins can see it. */
    public void send(BotContext ctx, FrameWriter writer, SendPacket packet) throws PluginException, IOException {
        run(ctx.withEvent(packet), writer);
    }

    /** Re-inject a synthetic inbound event as if it had arrived on the wire. */
    public void sendFakeEvent(BotContext ctx, FrameWriter writer, OneBotEvent event)
            throws PluginException, IOException {
        run(ctx.withEvent(event), writer);
    }

    /**
     * Run every enabled plugin's init hook once. A failing plugin is logged
     * and does not stop the others.
     */
    public void runInit(BotContext ctx) {
        Set<String> enabled = ctx.getConfig().enabledPlugins();
        long active = plugins.stream().filter(p -> enabled.contains(p.name())).count();
        log.info("[plugin] loading plugins ({}/{} enabled)", active, plugins.size());
        for (BotPlugin plugin : plugins) {
            if (!enabled.contains(plugin.name())) {
                continue;
            }
            try {
                plugin.init(ctx);
                log.info("[plugin] {} ready", plugin.name());
            } catch (Exception e) {
                log.error("[plugin] {} init failed: {}", plugin.name(), e.getMessage(), e);
            }
        }
    }

    /** Notify enabled plugins that a connection is up. */
    public void runConnected(BotContext ctx, FrameWriter writer) {
        Set<String> enabled = ctx.getConfig().enabledPlugins();
        for (BotPlugin plugin : plugins) {
            if (!enabled.contains(plugin.name())) {
                continue;
            }
            try {
                plugin.onConnected(ctx, writer);
            } catch (Exception e) {
                log.error("[plugin] {} connected hook failed: {}", plugin.name(), e.getMessage(), e);
            }
        }
    }

    /** Shut plugins down in reverse registration order. Failures are logged. */
    @Override
    public void close() {
        for (int i = plugins.size() - 1; i >= 0; i--) {
            BotPlugin plugin = plugins.get(i);
            try {
                plugin.shutdown();
            } catch (Exception e) {
                log.error("[plugin] {} shutdown failed: {}", plugin.name(), e.getMessage(), e);
            }
        }
        log.info("[plugin] {} plugin(s) shut down", plugins.size());
    }

    public static final class Builder {

        private final List<BotPlugin> plugins = new ArrayList<>();

        private Builder() {
        }

        public Builder register(BotPlugin plugin) {
            for (BotPlugin existing : plugins) {
                if (existing.name().equals(plugin.name())) {
                    throw new IllegalArgumentException("duplicate plugin name: " + plugin.name());
                }
            }
            plugins.add(plugin);
            return this;
        }

        /** Register a bare handler with the default {@code {"enabled": true}} block. */
        public Builder register(String name, PluginHandler handler) {
            return register(new BotPlugin() {
                @Override
                public String name() {
                    return name;
                }

                @Override
                public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception {
                    return handler.handle(ctx, writer);
                }
            });
        }

        public PluginPipeline build() {
            return new PluginPipeline(new ArrayList<>(plugins));
        }
    }
}
