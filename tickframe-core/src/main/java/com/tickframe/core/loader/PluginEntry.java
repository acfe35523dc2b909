package com.tickframe.core.loader;

import com.tickframe.api.plugin.PluginConfig;

/**
 * 宿主配置中的一个插件条目
 *
 * @param name   插件名
 * @param config 初始配置
 */
public record PluginEntry(String name, PluginConfig config) {
}
