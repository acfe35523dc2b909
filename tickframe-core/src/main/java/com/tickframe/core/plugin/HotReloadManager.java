package com.tickframe.core.plugin;

import com.tickframe.api.event.lifecycle.PluginReloadedEvent;
import com.tickframe.api.exception.ReloadException;
import com.tickframe.api.plugin.FailureKind;
import com.tickframe.api.plugin.PluginFactory;
import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginMetadata;
import com.tickframe.api.plugin.PluginState;
import com.tickframe.core.dev.PluginSourceWatcher;
import com.tickframe.core.loader.DirectoryPluginSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 热重载管理器
 * <p>
 * 流程：cleanup 旧实例 -> 移出派发 -> 加载新定义 -> 重新解析加载顺序 -> 构造并初始化新实例。
 * 新定义初始化失败时不回滚，插件停在 FAILED (RELOAD)。
 * DataBus 上的旧数据保留，直到新实例重新写入。
 * </p>
 * 只允许在帧之间执行；其他线程（如文件监听）通过 {@link #requestReload(String)} 排队，
 * 在下一帧边界统一处理。
 */
@Slf4j
public class HotReloadManager implements AutoCloseable {

    private final PluginManager manager;

    // 跨线程的重载请求，帧边界消费
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();

    // 已排队的插件名，add() 的返回值决定是否入队
    private final Set<String> requested = ConcurrentHashMap.newKeySet();

    private PluginSourceWatcher watcher;

    HotReloadManager(PluginManager manager) {
        this.manager = manager;
    }

    /**
     * 从注册时的来源重新加载
     *
     * @throws IllegalArgumentException 插件不存在
     * @throws IllegalStateException    在插件回调期间调用，或运行时已关闭
     */
    public ReloadResult reload(String name) {
        return doReload(name, null);
    }

    /**
     * 用给定的新定义替换
     *
     * @throws ReloadException 新定义的插件名不一致（不做任何变更）
     */
    public ReloadResult reload(String name, PluginFactory factory) {
        PluginMetadata metadata = factory.metadata();
        if (metadata == null || !name.equals(metadata.getName())) {
            throw new ReloadException("Cannot reload '" + name + "' with a definition named '"
                    + (metadata != null ? metadata.getName() : null) + "'");
        }
        return doReload(name, factory);
    }

    /**
     * 线程安全：排队，下一帧边界执行
     */
    public void requestReload(String name) {
        if (!requested.add(name)) {
            log.debug("[{}] Reload already requested", name);
            return;
        }
        pending.add(name);
        log.info("[{}] Reload requested, will apply at next tick boundary", name);
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * 执行所有排队的重载（由 PluginManager 在帧边界调用）
     */
    public List<ReloadResult> applyPending() {
        List<ReloadResult> results = new ArrayList<>();
        String name;
        while ((name = pending.poll()) != null) {
            // 出队后再到达的请求会在下一帧边界重新执行
            requested.remove(name);
            if (!manager.isRegistered(name)) {
                log.warn("[{}] Skipping requested reload: plugin is no longer registered", name);
                continue;
            }
            results.add(reload(name));
        }
        return results;
    }

    /**
     * 来源修改时间晚于上次加载的插件
     */
    public List<String> checkForUpdates() {
        List<String> modified = new ArrayList<>();
        for (PluginSlot slot : manager.getRegistry().all()) {
            long lastModified;
            try {
                lastModified = slot.getSource().lastModified();
            } catch (RuntimeException e) {
                log.warn("[{}] Cannot read modification time of {}", slot.getName(), slot.getSource().describe(), e);
                continue;
            }
            if (lastModified > 0 && lastModified > slot.getLoadedAt()) {
                modified.add(slot.getName());
            }
        }
        return modified;
    }

    /**
     * 轮询方式的自动重载
     */
    public List<ReloadResult> autoReloadModified() {
        List<ReloadResult> results = new ArrayList<>();
        for (String name : checkForUpdates()) {
            log.info("[{}] Source modified, reloading", name);
            results.add(reload(name));
        }
        return results;
    }

    /**
     * 监听插件目录，变更时调用 {@link #requestReload(String)}
     * 仅对目录来源生效
     *
     * @return 是否开始监听
     */
    public synchronized boolean watch(String name) {
        PluginSlot slot = manager.getRegistry().get(name);
        if (!(slot.getSource() instanceof DirectoryPluginSource source)) {
            log.debug("[{}] Source {} cannot be watched", name, slot.getSource().describe());
            return false;
        }
        if (watcher == null) {
            watcher = new PluginSourceWatcher(this, manager.getConfig().getWatchDebounceMillis());
        }
        watcher.register(name, source.getDirectory());
        return true;
    }

    @Override
    public synchronized void close() {
        pending.clear();
        requested.clear();
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
    }

    // ==================== 内部方法 ====================

    private ReloadResult doReload(String name, PluginFactory replacement) {
        if (manager.isShutdown()) {
            throw new IllegalStateException("PluginManager is shutdown");
        }
        manager.ensureNotDispatching("reload");
        PluginLifecycleManager lifecycle = manager.getLifecycleManager();
        PluginSlot slot = manager.getRegistry().get(name);
        String previousVersion = slot.getVersion();
        long begin = System.currentTimeMillis();

        // 尚未启动：只替换定义
        if (!manager.isStarted()) {
            PluginFactory factory = replacement != null ? replacement : slot.getSource().load();
            slot.setFactory(factory);
            slot.setLoadedAt(slot.getSource().lastModified());
            log.info("[{}] Definition replaced before start (v{} -> v{})", name, previousVersion, slot.getVersion());
            return finish(slot, previousVersion, begin);
        }

        log.info("[{}] Hot reloading v{} (state {})", name, previousVersion, slot.getState());
        lifecycle.teardown(slot);

        try {
            PluginFactory factory = replacement != null ? replacement : slot.getSource().load();
            PluginMetadata metadata = factory.metadata();
            if (metadata == null) {
                throw new ReloadException("New definition of '" + name + "' exposes no metadata");
            }
            metadata.validate();
            if (!name.equals(metadata.getName())) {
                throw new ReloadException("New definition of '" + name + "' is named '" + metadata.getName() + "'");
            }
            slot.setFactory(factory);
            slot.setLoadedAt(slot.getSource().lastModified());
        } catch (Throwable e) {
            PluginLifecycleManager.rethrowIfFatal(e);
            String message = "Failed to load new definition: " + e.getMessage();
            ReloadException cause = e instanceof ReloadException re ? re : new ReloadException(message, e);
            lifecycle.fail(slot, PluginFailure.of(FailureKind.RELOAD, message, cause));
            return finish(slot, previousVersion, begin);
        }

        // 重新解析并初始化 RELOADING 的插件
        manager.resolveAndInitialize();
        return finish(slot, previousVersion, begin);
    }

    private ReloadResult finish(PluginSlot slot, String previousVersion, long begin) {
        PluginState state = slot.getState();
        boolean success = state.isInitialized() || state == PluginState.UNRESOLVED;
        ReloadResult result = new ReloadResult(slot.getName(), success, previousVersion, slot.getVersion(),
                state, slot.getFailure(), System.currentTimeMillis() - begin);

        if (success) {
            log.info("[{}] Reload complete: {}", slot.getName(), result);
        } else {
            log.error("[{}] Reload failed, plugin left {}: {}", slot.getName(), state,
                    slot.getFailure() != null ? slot.getFailure().message() : "unknown");
        }
        manager.getLifecycleEventBus().publish(
                new PluginReloadedEvent(slot.getName(), previousVersion, slot.getVersion(), success));
        return result;
    }
}
