package com.tickframe.api.event.lifecycle;

import com.tickframe.api.plugin.PluginFailure;
import lombok.Getter;

/**
 * 插件失败事件
 * 场景：告警、运维面板展示失败原因
 */
@Getter
public class PluginFailedEvent extends PluginLifecycleEvent {

    private final PluginFailure failure;

    public PluginFailedEvent(String pluginName, String version, PluginFailure failure) {
        super(pluginName, version);
        this.failure = failure;
    }

    @Override
    public String toString() {
        return super.toString() + " failure=" + failure;
    }
}
