package com.tickframe.core.dev;

import com.tickframe.core.plugin.HotReloadManager;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 插件目录监听器
 * 职责：监听插件目录变化，防抖后向 {@link HotReloadManager} 提交重载请求
 * <p>
 * 只排队，不直接重载：真正的重载发生在帧循环线程的下一帧边界。
 * </p>
 */
@Slf4j
public class PluginSourceWatcher implements AutoCloseable {

    private final WatchService watchService;
    private final HotReloadManager reloadManager;
    private final long debounceMillis;
    private final Map<WatchKey, String> keyPluginMap = new ConcurrentHashMap<>();

    // 防抖：每个插件独立计时，一次保存产生的多个事件只触发一次
    private final Map<String, ScheduledFuture<?>> debounceTasks = new ConcurrentHashMap<>();
    private final ScheduledExecutorService debounceExecutor = Executors.newSingleThreadScheduledExecutor(
            r -> {
                Thread t = new Thread(r, "tickframe-watch-debounce");
                t.setDaemon(true);
                return t;
            }
    );

    private final Thread watchThread;
    private volatile boolean running = true;

    public PluginSourceWatcher(HotReloadManager reloadManager, long debounceMillis) {
        this.reloadManager = reloadManager;
        this.debounceMillis = debounceMillis;
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to init PluginSourceWatcher", e);
        }
        this.watchThread = new Thread(this::watchLoop, "tickframe-source-watcher");
        this.watchThread.setDaemon(true);
        this.watchThread.start();
    }

    /**
     * 注册监听目录（含子目录）
     */
    public void register(String pluginName, File directory) {
        try (Stream<Path> dirs = Files.walk(directory.toPath())) {
            dirs.filter(Files::isDirectory).forEach(dir -> {
                try {
                    WatchKey key = dir.register(watchService,
                            StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_MODIFY,
                            StandardWatchEventKinds.ENTRY_DELETE);
                    keyPluginMap.put(key, pluginName);
                } catch (IOException e) {
                    log.warn("[{}] Failed to watch subdir: {}", pluginName, dir, e);
                }
            });
            log.info("[{}] Watching directory: {}", pluginName, directory.getAbsolutePath());
        } catch (IOException e) {
            log.warn("[{}] Failed to watch dir: {}", pluginName, directory, e);
        }
    }

    public boolean isWatching(String pluginName) {
        return keyPluginMap.containsValue(pluginName);
    }

    private void watchLoop() {
        while (running) {
            try {
                WatchKey key = watchService.take();
                // 事件内容不关心，只需要知道哪个插件变了
                key.pollEvents();
                String pluginName = keyPluginMap.get(key);
                if (pluginName != null) {
                    scheduleReload(pluginName);
                }
                // 重置失败说明目录已不可访问
                if (!key.reset()) {
                    keyPluginMap.remove(key);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (Exception e) {
                log.error("Error in source watch loop", e);
            }
        }
    }

    private void scheduleReload(String pluginName) {
        debounceTasks.compute(pluginName, (name, previous) -> {
            if (previous != null && !previous.isDone()) {
                previous.cancel(false);
            }
            return debounceExecutor.schedule(() -> {
                debounceTasks.remove(name);
                log.info("⚡ Detected change in plugin sources: {}", name);
                reloadManager.requestReload(name);
            }, debounceMillis, TimeUnit.MILLISECONDS);
        });
    }

    @Override
    public void close() {
        running = false;
        debounceExecutor.shutdownNow();
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service", e);
        }
        watchThread.interrupt();
        keyPluginMap.clear();
        log.info("PluginSourceWatcher closed");
    }
}
