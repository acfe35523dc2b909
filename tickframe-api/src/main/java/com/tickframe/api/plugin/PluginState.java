package com.tickframe.api.plugin;

/**
 * 插件状态
 * <pre>
 * UNRESOLVED -> INITIALIZING -> ACTIVE <-> DISABLED -> RELOADING -> ACTIVE / FAILED -> UNLOADED
 * </pre>
 */
public enum PluginState {

    UNRESOLVED,
    INITIALIZING,
    ACTIVE,
    DISABLED,
    RELOADING,
    /**
     * 当前实例终态，名称仍保留在注册表中，供依赖方检测
     */
    FAILED,
    UNLOADED;

    /**
     * 是否已成功初始化（可以满足硬依赖）
     */
    public boolean isInitialized() {
        return this == ACTIVE || this == DISABLED;
    }
}
