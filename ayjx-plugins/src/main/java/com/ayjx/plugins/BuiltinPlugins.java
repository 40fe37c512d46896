package com.ayjx.plugins;

import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.plugins.basic.EchoPlugin;
import com.ayjx.plugins.basic.FilterMetaEventPlugin;
import com.ayjx.plugins.basic.LoggerPlugin;
import com.ayjx.plugins.basic.RecallPlugin;
import com.ayjx.plugins.repeater.RepeaterPlugin;
import com.ayjx.plugins.webshot.PageCapturer;
import com.ayjx.plugins.webshot.WebShotPlugin;

/**
 * The bundled plugins in execution order. Filters and logging come first so
 * every later plugin sees only events worth handling, and every outgoing
 * packet is logged before anything can drop it.
 */
public final class BuiltinPlugins {

    private BuiltinPlugins() {
    }

    public static PluginPipeline.Builder register(PluginPipeline.Builder builder, PageCapturer capturer) {
        return builder
                .register(new FilterMetaEventPlugin())
                .register(new LoggerPlugin())
                .register(new RecallPlugin())
                .register(new EchoPlugin())
                .register(new RepeaterPlugin())
                .register(new WebShotPlugin(capturer));
    }

    public static PluginPipeline pipeline(PageCapturer capturer) {
        return register(PluginPipeline.builder(), capturer).build();
    }
}
