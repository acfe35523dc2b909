package com.tickframe.api.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 单个插件实例的运行配置
 * <p>
 * 宿主可在运行时修改，下一帧生效。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginConfig {

    /**
     * 关闭后不参与 update / render / 事件 / 按键派发
     */
    @Builder.Default
    private boolean enabled = true;

    /**
     * 只影响 render
     */
    @Builder.Default
    private boolean visible = true;

    /**
     * 渲染顺序，升序绘制，相同时按加载顺序
     */
    @Builder.Default
    private int zIndex = 0;

    /**
     * 构造时传给插件的业务参数
     */
    @Builder.Default
    private Map<String, Object> settings = new HashMap<>();

    public static PluginConfig defaults() {
        return PluginConfig.builder().build();
    }

    /**
     * 读取业务参数，类型由调用方决定
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key, T defaultValue) {
        if (settings == null) {
            return defaultValue;
        }
        Object value = settings.get(key);
        return value != null ? (T) value : defaultValue;
    }

    /**
     * 拷贝（settings 浅拷贝）
     */
    public PluginConfig copy() {
        return new PluginConfig(enabled, visible, zIndex,
                settings != null ? new HashMap<>(settings) : new HashMap<>());
    }
}
