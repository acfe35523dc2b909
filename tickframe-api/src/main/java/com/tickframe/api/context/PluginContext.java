package com.tickframe.api.context;

import com.tickframe.api.bus.DataBus;
import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.plugin.PluginConfig;

/**
 * 插件上下文
 * 插件构造时获得，是访问共享状态（DataBus、事件）的唯一入口
 *
 * @author TickFrame
 */
public interface PluginContext {

    /**
     * 获取当前插件名
     */
    String getPluginName();

    /**
     * 获取当前插件配置（宿主可能在运行时修改）
     */
    PluginConfig getConfig();

    /**
     * 获取共享数据总线
     */
    DataBus getDataBus();

    /**
     * 投递事件，本帧所有 update 结束后统一派发
     */
    void postEvent(PluginEvent event);

    default void postEvent(String type, Object payload) {
        postEvent(PluginEvent.of(type, payload));
    }

    /**
     * 读取业务参数
     */
    default <T> T getSetting(String key, T defaultValue) {
        return getConfig().getSetting(key, defaultValue);
    }

    /**
     * 以当前插件身份写入 DataBus
     */
    void provide(String key, Object value);

    default <T> T get(String key, T defaultValue) {
        return getDataBus().get(key, defaultValue);
    }

    /**
     * 读取必需数据，缺失时的描述带上插件名
     */
    <T> T require(String key);
}
