package com.tickframe.api.event.lifecycle;

import com.tickframe.api.plugin.PluginState;
import lombok.Getter;

/**
 * 状态迁移事件，每次迁移发布一次
 */
@Getter
public class PluginStateChangedEvent extends PluginLifecycleEvent {

    private final PluginState from;
    private final PluginState to;

    public PluginStateChangedEvent(String pluginName, String version, PluginState from, PluginState to) {
        super(pluginName, version);
        this.from = from;
        this.to = to;
    }

    @Override
    public String toString() {
        return super.toString() + " " + from + " -> " + to;
    }
}
