package com.tickframe.core.resolver;

import com.tickframe.api.plugin.PluginMetadata;

/**
 * 解析输入：一个已注册插件
 *
 * @param metadata    元数据
 * @param enabled     是否启用（只有启用的提供方才会产生软依赖边）
 * @param failed      是否已失败（初始化失败或运行时故障）
 * @param initialized 是否已初始化成功，已初始化的插件不会被解析结果判定失败
 */
public record ResolverNode(PluginMetadata metadata, boolean enabled, boolean failed, boolean initialized) {

    public static ResolverNode pending(PluginMetadata metadata) {
        return new ResolverNode(metadata, true, false, false);
    }

    public String name() {
        return metadata.getName();
    }
}
