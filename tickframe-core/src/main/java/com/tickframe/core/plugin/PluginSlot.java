package com.tickframe.core.plugin;

import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.api.plugin.PluginFactory;
import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginMetadata;
import com.tickframe.api.plugin.PluginState;
import com.tickframe.api.plugin.TickPlugin;
import com.tickframe.core.loader.PluginSource;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * 插件槽位：以插件名为键的稳定句柄
 * <p>
 * 热重载只替换槽位里的定义和实例，槽位本身（注册顺序、配置）保持不变。
 * </p>
 */
@Getter
public class PluginSlot {

    private final String name;

    // 注册序号，拓扑排序平局时使用
    private final int registrationIndex;

    private final PluginSource source;

    private final PluginConfig config;

    @Setter(AccessLevel.PACKAGE)
    private PluginFactory factory;

    @Setter(AccessLevel.PACKAGE)
    private TickPlugin instance;

    @Setter(AccessLevel.PACKAGE)
    private volatile PluginState state = PluginState.UNRESOLVED;

    @Setter(AccessLevel.PACKAGE)
    private PluginFailure failure;

    // initialize() 返回过 true 的实例才需要 cleanup
    @Setter(AccessLevel.PACKAGE)
    private boolean instanceInitialized;

    // 最近一次加载时来源的修改时间，用于变更检测
    @Setter(AccessLevel.PACKAGE)
    private long loadedAt;

    PluginSlot(String name, int registrationIndex, PluginSource source, PluginFactory factory, PluginConfig config) {
        this.name = name;
        this.registrationIndex = registrationIndex;
        this.source = source;
        this.factory = factory;
        this.config = config;
    }

    public PluginMetadata getMetadata() {
        return factory.metadata();
    }

    public String getVersion() {
        return factory.metadata().getVersion();
    }

    /**
     * 是否参与本帧 update / 事件 / 按键派发
     */
    public boolean isActive() {
        return state == PluginState.ACTIVE;
    }

    public boolean isFailed() {
        return state == PluginState.FAILED;
    }

    @Override
    public String toString() {
        return String.format("PluginSlot{name='%s', state=%s}", name, state);
    }
}
