package com.tickframe.api.event.lifecycle;

import lombok.Getter;

/**
 * 热重载完成事件（无论成功与否都会发布）
 */
@Getter
public class PluginReloadedEvent extends PluginLifecycleEvent {

    private final String previousVersion;
    private final boolean success;

    public PluginReloadedEvent(String pluginName, String previousVersion, String version, boolean success) {
        super(pluginName, version);
        this.previousVersion = previousVersion;
        this.success = success;
    }
}
