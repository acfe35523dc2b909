package com.tickframe.api.event.lifecycle;

/**
 * 注册完成事件
 */
public class PluginRegisteredEvent extends PluginLifecycleEvent {
    public PluginRegisteredEvent(String pluginName, String version) {
        super(pluginName, version);
    }
}
