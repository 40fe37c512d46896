package com.ayjx.core.pipeline;

/**
 * A plugin handler failed while processing one event.
 */
public class PluginException extends Exception {

    private final String pluginName;

    public PluginException(String pluginName, String message, Throwable cause) {
        super("[" + pluginName + "] " + message, cause);
        this.pluginName = pluginName;
    }

    public PluginException(String pluginName, Throwable cause) {
        this(pluginName, String.valueOf(cause.getMessage()), cause);
    }

    public String getPluginName() {
        return pluginName;
    }
}
