package com.tickframe.core.resolver;

import com.tickframe.api.plugin.PluginFailure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析结果
 *
 * @param loadOrder 未失败插件的加载顺序
 * @param cycles    检测到的硬依赖环（每个环按注册顺序列出成员）
 * @param failures  本次解析判定失败的插件（按判定顺序）
 */
public record Resolution(List<String> loadOrder, List<List<String>> cycles, Map<String, PluginFailure> failures) {

    public Resolution {
        loadOrder = List.copyOf(loadOrder);
        cycles = cycles.stream().map(List::copyOf).toList();
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isFailed(String name) {
        return failures.containsKey(name);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /**
     * 插件在加载顺序中的位置，不存在时返回 -1
     */
    public int positionOf(String name) {
        return loadOrder.indexOf(name);
    }
}
