package com.tickframe.core.loader;

import com.tickframe.api.plugin.PluginFactory;

/**
 * 插件定义来源
 * 热重载时重新调用 {@link #load()} 获取新定义
 */
public interface PluginSource extends AutoCloseable {

    /**
     * 加载（或重新加载）插件定义
     *
     * @throws com.tickframe.api.exception.TickFrameException 加载失败
     */
    PluginFactory load();

    /**
     * 来源最后修改时间（毫秒），不支持变更检测时返回 0
     */
    default long lastModified() {
        return 0L;
    }

    /**
     * 日志用描述
     */
    String describe();

    @Override
    default void close() {
        // nothing to release
    }
}
