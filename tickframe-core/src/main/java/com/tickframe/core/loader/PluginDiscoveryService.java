package com.tickframe.core.loader;

import com.tickframe.api.exception.ConfigurationException;
import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.core.config.TickFrameConfig;
import com.tickframe.core.plugin.PluginManager;
import com.tickframe.core.plugin.PluginSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件自动发现服务
 * <p>
 * 职责：
 * 1. 扫描 pluginHome 下含 plugin.yml 的子目录
 * 2. 读取宿主配置，决定注册顺序与每个插件的 PluginConfig
 * 3. 调用 PluginManager 完成注册（开启 hotReload 时同时监听目录）
 * </p>
 * 注册顺序：先按宿主配置中的顺序，其余插件按目录名排序追加。
 */
@Slf4j
@RequiredArgsConstructor
public class PluginDiscoveryService {

    private final TickFrameConfig config;
    private final PluginManager pluginManager;

    /**
     * 执行扫描并注册
     *
     * @return 成功注册的插件名（注册顺序）
     */
    public List<String> scanAndLoad() {
        List<String> registered = new ArrayList<>();
        if (!config.isAutoScan()) {
            log.info("AutoScan is disabled, skipping plugin discovery");
            return registered;
        }

        File home = new File(config.getPluginHome());
        if (!isValidRoot(home)) {
            return registered;
        }

        Map<String, File> discovered = discover(home);
        log.info("Discovered {} plugin directories in {}", discovered.size(), home.getAbsolutePath());

        List<PluginEntry> entries = loadHostConfig();
        for (PluginEntry entry : entries) {
            File dir = discovered.remove(entry.name());
            if (dir == null) {
                log.warn("[{}] Configured in {} but not found in {}", entry.name(),
                        config.getHostConfigFile(), config.getPluginHome());
                continue;
            }
            registerSingle(dir, entry.config(), registered);
        }
        // 未出现在宿主配置中的插件使用默认配置
        for (File dir : discovered.values()) {
            registerSingle(dir, PluginConfig.defaults(), registered);
        }

        log.info("Plugin discovery finished. Total registered: {}", registered.size());
        return registered;
    }

    /**
     * 插件名 -> 目录，按目录名排序
     */
    private Map<String, File> discover(File home) {
        Map<String, File> result = new LinkedHashMap<>();
        File[] files = home.listFiles(File::isDirectory);
        if (files == null) {
            return result;
        }
        Arrays.sort(files, Comparator.comparing(File::getName));
        for (File dir : files) {
            try {
                PluginManifest manifest = PluginManifestLoader.parse(dir);
                if (manifest == null) {
                    // 不是插件目录
                    continue;
                }
                File previous = result.putIfAbsent(manifest.getName(), dir);
                if (previous != null) {
                    log.error("[{}] Duplicate plugin in {} (already found in {}), skipping",
                            manifest.getName(), dir.getName(), previous.getName());
                }
            } catch (Exception e) {
                // 🔥坏插件只打印报错，不影响其他插件
                log.error("⚠️ Failed to read plugin manifest from: {}", dir.getAbsolutePath(), e);
            }
        }
        return result;
    }

    /**
     * 宿主配置无法解析时只打印报错，所有插件按目录顺序以默认配置注册
     */
    private List<PluginEntry> loadHostConfig() {
        try {
            return HostConfigLoader.load(new File(config.getHostConfigFile()));
        } catch (ConfigurationException e) {
            log.error("⚠️ Ignoring host config {}: {}", config.getHostConfigFile(), e.getMessage(), e);
            return List.of();
        }
    }

    private void registerSingle(File dir, PluginConfig pluginConfig, List<String> registered) {
        try {
            PluginSlot slot = pluginManager.register(new DirectoryPluginSource(dir), pluginConfig);
            registered.add(slot.getName());
            if (config.isHotReload()) {
                pluginManager.getHotReloadManager().watch(slot.getName());
            }
        } catch (Exception e) {
            log.error("⚠️ Failed to register plugin from: {}", dir.getAbsolutePath(), e);
        }
    }

    private boolean isValidRoot(File root) {
        if (!root.exists()) {
            log.warn("Plugin home does not exist: {}", root.getAbsolutePath());
            return false;
        }
        if (!root.isDirectory()) {
            log.warn("Plugin home is not a directory: {}", root.getAbsolutePath());
            return false;
        }
        if (!root.canRead()) {
            log.error("Plugin home is not readable: {}", root.getAbsolutePath());
            return false;
        }
        return true;
    }
}
