package com.tickframe.api.plugin;

import com.tickframe.api.context.PluginContext;

/**
 * 插件定义：元数据 + 实例构造
 * <p>
 * 元数据必须在构造实例之前可用，注册和依赖解析只看元数据。
 * 通过目录加载的插件，其 mainClass 必须实现此接口并提供无参构造器。
 * </p>
 *
 * @author TickFrame
 */
public interface PluginFactory {

    PluginMetadata metadata();

    /**
     * 构造一个新实例，每次初始化或热重载都会调用
     */
    TickPlugin create(PluginContext context);
}
