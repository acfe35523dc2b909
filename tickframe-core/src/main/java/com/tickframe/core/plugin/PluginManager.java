package com.tickframe.core.plugin;

import com.tickframe.api.bus.DataBus;
import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.event.lifecycle.PluginRegisteredEvent;
import com.tickframe.api.exception.ConfigurationException;
import com.tickframe.api.exception.MissingDependencyException;
import com.tickframe.api.frame.Frame;
import com.tickframe.api.plugin.FailureKind;
import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.api.plugin.PluginFactory;
import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginState;
import com.tickframe.core.bus.DefaultDataBus;
import com.tickframe.core.config.TickFrameConfig;
import com.tickframe.core.event.LifecycleEventBus;
import com.tickframe.core.event.PluginEventBus;
import com.tickframe.core.loader.FactoryPluginSource;
import com.tickframe.core.loader.PluginSource;
import com.tickframe.core.resolver.DependencyResolver;
import com.tickframe.core.resolver.Resolution;
import com.tickframe.core.resolver.ResolverNode;
import com.tickframe.core.scheduler.TickScheduler;
import jakarta.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 插件运行时门面
 * 职责：
 * 1. 插件的注册与移除 (Register/Unregister)
 * 2. 依赖解析与初始化 (Resolve/Initialize)
 * 3. 帧驱动：update、事件、render、按键 (Tick)
 * 4. 运行期配置切换 (enabled/visible/zIndex)
 * 5. 资源的全局回收 (Shutdown)
 * <p>
 * 非线程安全：除 {@link HotReloadManager#requestReload(String)} 外，
 * 所有方法都应在驱动帧循环的同一线程上调用。
 * </p>
 */
@Slf4j
public class PluginManager {

    private final TickFrameConfig config;

    private final DefaultDataBus dataBus;
    private final PluginEventBus eventBus;
    private final LifecycleEventBus lifecycleEventBus;

    private final PluginRegistry registry;
    private final DependencyResolver resolver;
    private final PluginLifecycleManager lifecycleManager;
    private final TickScheduler scheduler;
    private final HotReloadManager hotReloadManager;

    private Resolution lastResolution = new Resolution(List.of(), List.of(), Map.of());

    private boolean started = false;
    private boolean shutdown = false;

    // 注册表或启用状态变化后，下一帧边界重新解析
    private boolean dirty = false;

    public PluginManager() {
        this(TickFrameConfig.defaults());
    }

    public PluginManager(TickFrameConfig config) {
        this(config,
                new DefaultDataBus(),
                new PluginEventBus(config.getMaxQueuedEvents()),
                new LifecycleEventBus());
    }

    public PluginManager(TickFrameConfig config,
                         DefaultDataBus dataBus,
                         PluginEventBus eventBus,
                         LifecycleEventBus lifecycleEventBus) {
        this.config = config;
        this.dataBus = dataBus;
        this.eventBus = eventBus;
        this.lifecycleEventBus = lifecycleEventBus;
        this.registry = new PluginRegistry();
        this.resolver = new DependencyResolver();
        this.lifecycleManager = new PluginLifecycleManager(dataBus, eventBus, lifecycleEventBus);
        this.scheduler = new TickScheduler(registry, lifecycleManager, dataBus, eventBus);
        this.hotReloadManager = new HotReloadManager(this);
    }

    // ==================== 注册 ====================

    public PluginSlot register(PluginFactory factory) {
        return register(factory, PluginConfig.defaults());
    }

    public PluginSlot register(PluginFactory factory, PluginConfig pluginConfig) {
        return register(new FactoryPluginSource(factory), pluginConfig);
    }

    /**
     * 注册插件
     * start() 之后注册的插件在下一帧边界解析并初始化
     *
     * @throws ConfigurationException 元数据非法、重名或来源无法加载
     */
    public PluginSlot register(PluginSource source, PluginConfig pluginConfig) {
        ensureNotShutdown();
        PluginFactory factory;
        try {
            factory = source.load();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to load plugin from " + source.describe() + ": " + e.getMessage(), e);
        }

        PluginSlot slot;
        try {
            slot = registry.register(source, factory, pluginConfig);
        } catch (ConfigurationException e) {
            log.error("Registration rejected ({}): {}", source.describe(), e.getMessage());
            closeSource(source);
            throw e;
        }
        slot.setLoadedAt(source.lastModified());
        lifecycleEventBus.publish(new PluginRegisteredEvent(slot.getName(), slot.getVersion()));
        log.info("[{}] Registered v{} from {}", slot.getName(), slot.getVersion(), source.describe());

        if (started) {
            dirty = true;
        }
        return slot;
    }

    /**
     * 移除插件：cleanup 后进入 UNLOADED，并从注册表删除
     * 依赖它的已运行插件随之失败 (MissingDependency)
     */
    public void unregister(String name) {
        ensureNotDispatching("unregister");
        PluginSlot slot = registry.get(name);

        lifecycleManager.unload(slot);
        registry.remove(name);
        closeSource(slot.getSource());
        lifecycleEventBus.unsubscribeAll(name);

        cascadeRemoval(name);
        if (started) {
            dirty = true;
        }
    }

    // ==================== 帧驱动 ====================

    /**
     * 解析全部依赖并初始化所有插件
     */
    public void start() {
        ensureNotShutdown();
        if (started) {
            log.warn("PluginManager already started");
            return;
        }
        started = true;
        log.info("Starting TickFrame runtime with {} plugins", registry.size());
        resolveAndInitialize();
        log.info("TickFrame runtime started. Load order: {}", getLoadOrder());
    }

    /**
     * 执行一帧的逻辑阶段
     * 帧边界上依次处理：待执行的热重载、重新解析，然后 update 与事件派发
     *
     * @param deltaTime 距上一帧的秒数
     */
    public void tick(double deltaTime) {
        ensureRunning();
        ensureNotDispatching("tick");

        hotReloadManager.applyPending();
        if (dirty) {
            resolveAndInitialize();
        }
        scheduler.runTick(deltaTime);
    }

    /**
     * 渲染：帧依次穿过可见插件，返回最终帧
     */
    public Frame render(Frame frame) {
        ensureRunning();
        ensureNotDispatching("render");
        return scheduler.render(frame);
    }

    /**
     * 按键派发
     *
     * @return 是否有插件消费
     */
    public boolean dispatchKey(String key) {
        ensureRunning();
        ensureNotDispatching("dispatchKey");
        return scheduler.dispatchKey(key);
    }

    /**
     * 宿主投递事件，下一次派发时送达
     */
    public void postEvent(String type, Object payload) {
        eventBus.post(PluginEvent.of(type, payload).stamp(null, scheduler.getCurrentTick()));
    }

    // ==================== 运行期配置 ====================

    public void enable(String name) {
        setEnabled(name, true);
    }

    public void disable(String name) {
        setEnabled(name, false);
    }

    private void setEnabled(String name, boolean enabled) {
        PluginConfig pluginConfig = registry.get(name).getConfig();
        if (pluginConfig.isEnabled() == enabled) {
            return;
        }
        pluginConfig.setEnabled(enabled);
        log.info("[{}] {} (effective next tick)", name, enabled ? "Enabled" : "Disabled");
        // 软依赖边只统计启用的提供方，顺序随之重算
        if (started) {
            dirty = true;
        }
    }

    public void setVisible(String name, boolean visible) {
        registry.get(name).getConfig().setVisible(visible);
        log.debug("[{}] visible={}", name, visible);
    }

    /**
     * @return 切换后的可见性
     */
    public boolean toggleVisibility(String name) {
        PluginConfig pluginConfig = registry.get(name).getConfig();
        pluginConfig.setVisible(!pluginConfig.isVisible());
        log.debug("[{}] visible={}", name, pluginConfig.isVisible());
        return pluginConfig.isVisible();
    }

    public void setZIndex(String name, int zIndex) {
        registry.get(name).getConfig().setZIndex(zIndex);
        log.debug("[{}] zIndex={}", name, zIndex);
    }

    // ==================== 查询 ====================

    /**
     * @throws IllegalArgumentException 插件不存在
     */
    public PluginState getState(String name) {
        return registry.get(name).getState();
    }

    public Optional<PluginFailure> getFailure(String name) {
        return Optional.ofNullable(registry.get(name).getFailure());
    }

    /**
     * 当前加载顺序（不含失败插件）
     */
    public List<String> getLoadOrder() {
        List<String> order = new ArrayList<>();
        for (String name : scheduler.getLoadOrder()) {
            registry.find(name)
                    .filter(slot -> !slot.isFailed())
                    .ifPresent(slot -> order.add(name));
        }
        return Collections.unmodifiableList(order);
    }

    /**
     * 当前渲染顺序（ACTIVE 且可见）
     */
    public List<String> getRenderOrder() {
        return scheduler.renderOrder().stream().map(PluginSlot::getName).toList();
    }

    /**
     * 按注册顺序列出所有插件
     */
    public List<PluginInfo> listPlugins() {
        return registry.all().stream().map(PluginInfo::of).toList();
    }

    public Optional<PluginSlot> findPlugin(String name) {
        return registry.find(name);
    }

    public boolean isRegistered(String name) {
        return registry.contains(name);
    }

    public long getCurrentTick() {
        return scheduler.getCurrentTick();
    }

    public Resolution getLastResolution() {
        return lastResolution;
    }

    public DataBus getDataBus() {
        return dataBus;
    }

    public PluginEventBus getEventBus() {
        return eventBus;
    }

    public LifecycleEventBus getLifecycleEventBus() {
        return lifecycleEventBus;
    }

    public HotReloadManager getHotReloadManager() {
        return hotReloadManager;
    }

    public TickFrameConfig getConfig() {
        return config;
    }

    public boolean isStarted() {
        return started;
    }

    public RuntimeStats getStats() {
        int active = 0;
        int failed = 0;
        for (PluginSlot slot : registry.all()) {
            if (slot.isActive()) {
                active++;
            } else if (slot.isFailed()) {
                failed++;
            }
        }
        return new RuntimeStats(registry.size(), active, failed, scheduler.getCurrentTick(),
                dataBus.size(), eventBus.getPendingCount(), eventBus.getDroppedCount());
    }

    // ==================== 关闭 ====================

    /**
     * 按加载顺序逆序卸载所有插件并释放资源
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        ensureNotDispatching("shutdown");
        log.info("Shutting down PluginManager...");
        shutdown = true;

        hotReloadManager.close();

        Set<String> ordered = new LinkedHashSet<>(scheduler.getLoadOrder());
        List<PluginSlot> slots = new ArrayList<>();
        for (PluginSlot slot : registry.all()) {
            if (!ordered.contains(slot.getName())) {
                slots.add(slot);
            }
        }
        for (String name : ordered) {
            registry.find(name).ifPresent(slots::add);
        }
        Collections.reverse(slots);

        for (PluginSlot slot : slots) {
            try {
                lifecycleManager.unload(slot);
            } catch (Exception e) {
                log.error("[{}] Error while unloading", slot.getName(), e);
            }
            closeSource(slot.getSource());
        }

        eventBus.clear();
        dataBus.clear();
        log.info("PluginManager shutdown complete.");
    }

    // ==================== 内部方法 ====================

    /**
     * 重新解析依赖，并初始化所有待初始化 (UNRESOLVED / RELOADING) 的插件
     * 已初始化的插件不会因本次解析失败
     */
    void resolveAndInitialize() {
        dirty = false;
        List<ResolverNode> nodes = new ArrayList<>();
        for (PluginSlot slot : registry.all()) {
            nodes.add(new ResolverNode(slot.getMetadata(), slot.getConfig().isEnabled(),
                    slot.isFailed(), slot.getState().isInitialized()));
        }
        Resolution resolution = resolver.resolve(nodes);
        lastResolution = resolution;

        for (Map.Entry<String, PluginFailure> entry : resolution.failures().entrySet()) {
            PluginSlot slot = registry.get(entry.getKey());
            if (isPending(slot)) {
                lifecycleManager.fail(slot, entry.getValue());
            }
        }
        scheduler.setLoadOrder(resolution.loadOrder());

        // 加载顺序保证依赖先于依赖方初始化
        for (String name : resolution.loadOrder()) {
            PluginSlot slot = registry.get(name);
            if (!isPending(slot)) {
                continue;
            }
            PluginFailure blocked = checkHardDependencies(slot);
            if (blocked != null) {
                lifecycleManager.fail(slot, blocked);
                continue;
            }
            lifecycleManager.initialize(slot, slot.getState() == PluginState.RELOADING);
        }
    }

    private PluginFailure checkHardDependencies(PluginSlot slot) {
        for (String dep : slot.getMetadata().getDependencies()) {
            Optional<PluginSlot> target = registry.find(dep);
            if (target.isEmpty()) {
                return missing(dep, "Hard dependency '" + dep + "' is not registered");
            }
            if (!target.get().getState().isInitialized()) {
                return missing(dep, "Hard dependency '" + dep + "' failed to initialize");
            }
        }
        return null;
    }

    /**
     * 被移除插件的已运行依赖方（传递）全部失败
     */
    private void cascadeRemoval(String removed) {
        Set<String> gone = new HashSet<>();
        gone.add(removed);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (PluginSlot slot : registry.all()) {
                // 未初始化的插件交给下一次解析处理
                if (!slot.getState().isInitialized() || gone.contains(slot.getName())) {
                    continue;
                }
                for (String dep : slot.getMetadata().getDependencies()) {
                    if (gone.contains(dep)) {
                        String message = dep.equals(removed)
                                ? "Hard dependency '" + dep + "' was unregistered"
                                : "Hard dependency '" + dep + "' has failed";
                        lifecycleManager.fail(slot, missing(dep, message));
                        gone.add(slot.getName());
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    private PluginFailure missing(String dep, String message) {
        return new PluginFailure(FailureKind.MISSING_DEPENDENCY, message,
                new MissingDependencyException(message), List.of(dep));
    }

    private boolean isPending(PluginSlot slot) {
        return slot.getState() == PluginState.UNRESOLVED || slot.getState() == PluginState.RELOADING;
    }

    PluginRegistry getRegistry() {
        return registry;
    }

    PluginLifecycleManager getLifecycleManager() {
        return lifecycleManager;
    }

    boolean isShutdown() {
        return shutdown;
    }

    /**
     * 插件回调期间（帧内）禁止结构性变更
     */
    void ensureNotDispatching(String operation) {
        if (scheduler.isDispatching()) {
            throw new IllegalStateException(operation + "() is not allowed while plugins are being dispatched; "
                    + "use HotReloadManager.requestReload() or wait for the tick boundary");
        }
    }

    private void ensureRunning() {
        ensureNotShutdown();
        if (!started) {
            throw new IllegalStateException("PluginManager is not started");
        }
    }

    private void ensureNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("PluginManager is shutdown");
        }
    }

    private void closeSource(PluginSource source) {
        try {
            source.close();
        } catch (Exception e) {
            log.warn("Failed to close plugin source {}", source.describe(), e);
        }
    }

    // ==================== 统计信息 ====================

    public record RuntimeStats(
            int registered,
            int active,
            int failed,
            long tick,
            int dataKeys,
            int pendingEvents,
            long droppedEvents
    ) {
        @Override
        @Nonnull
        public String toString() {
            return String.format("RuntimeStats{registered=%d, active=%d, failed=%d, tick=%d, keys=%d, pendingEvents=%d, dropped=%d}",
                    registered, active, failed, tick, dataKeys, pendingEvents, droppedEvents);
        }
    }
}
