package com.phillippitts.genesis.exception;

/**
 * Thrown when a plugin cannot be created or misuses the resources it was given.
 */
public class PluginException extends GenesisException {

    private final String pluginName;

    public PluginException(String message, String pluginName) {
        super(message + " (plugin: " + pluginName + ")");
        this.pluginName = pluginName;
    }

    public PluginException(String message, String pluginName, Throwable cause) {
        super(message + " (plugin: " + pluginName + ")", cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
