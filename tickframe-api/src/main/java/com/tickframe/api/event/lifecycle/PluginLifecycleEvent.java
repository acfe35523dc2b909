package com.tickframe.api.event.lifecycle;

import com.tickframe.api.event.AbstractTickFrameEvent;
import lombok.Getter;

/**
 * 插件生命周期事件基类
 */
@Getter
public abstract class PluginLifecycleEvent extends AbstractTickFrameEvent {
    private final String pluginName;
    private final String version;

    public PluginLifecycleEvent(String pluginName, String version) {
        super();
        this.pluginName = pluginName;
        this.version = version;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + pluginName + ":" + version;
    }
}
