package com.tickframe.core.plugin;

import com.tickframe.api.plugin.PluginState;

/**
 * 插件概览（宿主展示用）
 */
public record PluginInfo(
        String name,
        String version,
        String author,
        String description,
        PluginState state,
        boolean enabled,
        boolean visible,
        int zIndex
) {

    static PluginInfo of(PluginSlot slot) {
        return new PluginInfo(
                slot.getName(),
                slot.getVersion(),
                slot.getMetadata().getAuthor(),
                slot.getMetadata().getDescription(),
                slot.getState(),
                slot.getConfig().isEnabled(),
                slot.getConfig().isVisible(),
                slot.getConfig().getZIndex()
        );
    }
}
