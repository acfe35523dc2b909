package com.tickframe.api.event.lifecycle;

/**
 * 卸载完成事件
 * 场景：清理宿主侧缓存
 */
public class PluginUnloadedEvent extends PluginLifecycleEvent {
    public PluginUnloadedEvent(String pluginName, String version) {
        super(pluginName, version);
    }
}
