package com.tickframe.core.plugin;

import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginState;
import jakarta.annotation.Nonnull;

/**
 * 一次热重载的结果
 *
 * @param failure 成功时为 null
 */
public record ReloadResult(
        String pluginName,
        boolean success,
        String previousVersion,
        String version,
        PluginState state,
        PluginFailure failure,
        long durationMillis
) {

    @Override
    @Nonnull
    public String toString() {
        return String.format("ReloadResult{plugin=%s, success=%s, %s -> %s, state=%s, %dms}",
                pluginName, success, previousVersion, version, state, durationMillis);
    }
}
