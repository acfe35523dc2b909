package com.tickframe.api.event.lifecycle;

import com.tickframe.api.plugin.PluginState;
import lombok.Getter;

/**
 * 初始化成功事件
 * 场景：状态面板、依赖方就绪检查
 */
@Getter
public class PluginInitializedEvent extends PluginLifecycleEvent {

    // ACTIVE 或 DISABLED
    private final PluginState state;

    public PluginInitializedEvent(String pluginName, String version, PluginState state) {
        super(pluginName, version);
        this.state = state;
    }
}
