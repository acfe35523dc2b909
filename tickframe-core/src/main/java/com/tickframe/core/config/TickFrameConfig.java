package com.tickframe.core.config;

import com.tickframe.core.event.PluginEventBus;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * TickFrame Core 全局配置对象
 * <p>
 * 职责：作为 Core 层的唯一配置入口，由宿主启动时构造一次并传入。
 * </p>
 */
@Data
@Builder
@ToString
public class TickFrameConfig {

    /**
     * 启动时是否自动扫描 pluginHome 下的插件目录
     */
    @Builder.Default
    private boolean autoScan = true;

    /**
     * 插件存放根目录（每个子目录一个插件，包含 plugin.yml）
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 宿主插件配置文件（注册顺序 + 每个插件的 PluginConfig）
     */
    @Builder.Default
    private String hostConfigFile = "tickframe.yml";

    /**
     * 是否监听插件目录并自动热重载
     */
    @Builder.Default
    private boolean hotReload = false;

    /**
     * 文件变化防抖时间，等待编译输出写完
     */
    @Builder.Default
    private long watchDebounceMillis = 500;

    /**
     * 插件事件队列上限，超出丢弃最旧事件
     */
    @Builder.Default
    private int maxQueuedEvents = PluginEventBus.DEFAULT_CAPACITY;

    public static TickFrameConfig defaults() {
        return TickFrameConfig.builder().build();
    }
}
