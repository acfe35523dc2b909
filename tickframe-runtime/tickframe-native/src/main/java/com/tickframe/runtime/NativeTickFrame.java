package com.tickframe.runtime;

import com.tickframe.core.config.TickFrameConfig;
import com.tickframe.core.loader.PluginDiscoveryService;
import com.tickframe.core.plugin.PluginManager;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * TickFrame Native 启动器
 * 宿主应用通过此类一键组装运行时：扫描插件目录、注册、解析依赖并初始化。
 * <p>
 * 帧循环由宿主驱动：
 * <pre>
 * PluginManager manager = NativeTickFrame.start(config);
 * while (running) {
 *     manager.tick(dt);
 *     frame = manager.render(frame);
 * }
 * </pre>
 * </p>
 */
@Slf4j
public class NativeTickFrame {

    private static PluginManager GLOBAL_PLUGIN_MANAGER;
    private static Thread SHUTDOWN_HOOK;

    private NativeTickFrame() {
    }

    /**
     * 启动 TickFrame (使用默认配置)
     */
    public static PluginManager start() {
        return start(TickFrameConfig.defaults());
    }

    /**
     * 启动 TickFrame (自定义配置)
     */
    public static synchronized PluginManager start(TickFrameConfig config) {
        if (GLOBAL_PLUGIN_MANAGER != null) {
            log.warn("TickFrame is already started.");
            return GLOBAL_PLUGIN_MANAGER;
        }

        long begin = System.currentTimeMillis();
        log.info("Starting TickFrame Native Runtime... {}", config);

        PluginManager pluginManager = new PluginManager(config);

        // 自动扫描插件
        PluginDiscoveryService discoveryService = new PluginDiscoveryService(config, pluginManager);
        log.info("Executing initial plugin scan...");
        List<String> registered = discoveryService.scanAndLoad();

        pluginManager.start();

        // 注册关闭钩子
        SHUTDOWN_HOOK = new Thread(() -> {
            log.info("TickFrame shutting down...");
            pluginManager.shutdown();
        }, "tickframe-shutdown");
        Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);

        GLOBAL_PLUGIN_MANAGER = pluginManager;
        log.info("TickFrame Native started in {} ms with {} plugins",
                System.currentTimeMillis() - begin, registered.size());
        return pluginManager;
    }

    /**
     * 当前运行时
     *
     * @throws IllegalStateException 尚未启动
     */
    public static synchronized PluginManager getPluginManager() {
        if (GLOBAL_PLUGIN_MANAGER == null) {
            throw new IllegalStateException("TickFrame not started");
        }
        return GLOBAL_PLUGIN_MANAGER;
    }

    public static synchronized boolean isStarted() {
        return GLOBAL_PLUGIN_MANAGER != null;
    }

    /**
     * 主动关闭（不等待 JVM 退出）
     */
    public static synchronized void stop() {
        if (GLOBAL_PLUGIN_MANAGER == null) {
            return;
        }
        GLOBAL_PLUGIN_MANAGER.shutdown();
        try {
            Runtime.getRuntime().removeShutdownHook(SHUTDOWN_HOOK);
        } catch (IllegalStateException e) {
            // JVM 已在关闭中
            log.debug("Shutdown already in progress");
        }
        GLOBAL_PLUGIN_MANAGER = null;
        SHUTDOWN_HOOK = null;
    }
}
