package com.tickframe.core.plugin;

import com.tickframe.api.event.TickFrameEvent;
import com.tickframe.api.event.lifecycle.PluginFailedEvent;
import com.tickframe.api.event.lifecycle.PluginInitializedEvent;
import com.tickframe.api.event.lifecycle.PluginStateChangedEvent;
import com.tickframe.api.event.lifecycle.PluginUnloadedEvent;
import com.tickframe.api.exception.InitializationException;
import com.tickframe.api.exception.ReloadException;
import com.tickframe.api.exception.RuntimeFaultException;
import com.tickframe.api.plugin.FailureKind;
import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginState;
import com.tickframe.api.plugin.TickPlugin;
import com.tickframe.core.bus.DefaultDataBus;
import com.tickframe.core.context.CorePluginContext;
import com.tickframe.core.event.LifecycleEventBus;
import com.tickframe.core.event.PluginEventBus;
import lombok.extern.slf4j.Slf4j;

/**
 * 插件生命周期管理器
 * 职责：实例的构造、初始化、失败标记、清理，以及对应的状态迁移事件
 * <p>
 * 插件抛出的异常在这里被转换为状态，不会越过插件边界传播。
 * </p>
 */
@Slf4j
public class PluginLifecycleManager {

    private final DefaultDataBus dataBus;
    private final PluginEventBus pluginEventBus;
    private final LifecycleEventBus lifecycleEventBus;

    public PluginLifecycleManager(DefaultDataBus dataBus,
                                  PluginEventBus pluginEventBus,
                                  LifecycleEventBus lifecycleEventBus) {
        this.dataBus = dataBus;
        this.pluginEventBus = pluginEventBus;
        this.lifecycleEventBus = lifecycleEventBus;
    }

    // ==================== 实例生命周期 ====================

    /**
     * 构造新实例并调用 initialize()
     *
     * @param reloading 是否处于热重载流程（失败分类为 RELOAD）
     * @return 是否初始化成功
     */
    public boolean initialize(PluginSlot slot, boolean reloading) {
        String name = slot.getName();
        FailureKind kind = reloading ? FailureKind.RELOAD : FailureKind.INITIALIZATION;
        transition(slot, PluginState.INITIALIZING);

        CorePluginContext context = new CorePluginContext(name, slot.getConfig(), dataBus, pluginEventBus);
        TickPlugin instance;
        try {
            instance = slot.getFactory().create(context);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            fail(slot, initFailure(kind, "Failed to construct plugin instance: " + e.getMessage(), e));
            return false;
        }
        if (instance == null) {
            fail(slot, initFailure(kind, "Plugin factory returned no instance", null));
            return false;
        }
        slot.setInstance(instance);

        boolean ok;
        try {
            ok = instance.initialize();
        } catch (Throwable e) {
            rethrowIfFatal(e);
            fail(slot, initFailure(kind, "initialize() threw " + e.getClass().getSimpleName() + ": " + e.getMessage(), e));
            return false;
        }
        if (!ok) {
            fail(slot, initFailure(kind, "initialize() returned false", null));
            return false;
        }

        slot.setInstanceInitialized(true);
        PluginState target = slot.getConfig().isEnabled() ? PluginState.ACTIVE : PluginState.DISABLED;
        transition(slot, target);
        publish(new PluginInitializedEvent(name, slot.getVersion(), target));
        log.info("[{}] Initialized v{} ({})", name, slot.getVersion(), target);
        return true;
    }

    /**
     * 标记失败（当前实例终态）
     */
    public void fail(PluginSlot slot, PluginFailure failure) {
        slot.setFailure(failure);
        transition(slot, PluginState.FAILED);
        if (failure.cause() != null && failure.kind() != FailureKind.MISSING_DEPENDENCY
                && failure.kind() != FailureKind.CIRCULAR_DEPENDENCY) {
            log.error("[{}] Plugin failed: {}", slot.getName(), failure, failure.cause());
        } else {
            log.error("[{}] Plugin failed: {}", slot.getName(), failure);
        }
        publish(new PluginFailedEvent(slot.getName(), slot.getVersion(), failure));
    }

    /**
     * 运行期故障（update / render / handleEvent / handleKey）
     */
    public void fault(PluginSlot slot, String phase, Throwable e) {
        rethrowIfFatal(e);
        String message = phase + " threw " + e.getClass().getSimpleName() + ": " + e.getMessage();
        RuntimeFaultException fault = new RuntimeFaultException("Plugin [" + slot.getName() + "] " + message, e);
        fail(slot, PluginFailure.of(FailureKind.RUNTIME_FAULT, message, fault));
    }

    /**
     * 热重载前拆除旧实例：cleanup 后进入 RELOADING
     */
    public void teardown(PluginSlot slot) {
        cleanupInstance(slot);
        slot.setFailure(null);
        transition(slot, PluginState.RELOADING);
    }

    /**
     * 卸载：cleanup 后进入 UNLOADED
     */
    public void unload(PluginSlot slot) {
        if (slot.getState() == PluginState.UNLOADED) {
            return;
        }
        cleanupInstance(slot);
        transition(slot, PluginState.UNLOADED);
        publish(new PluginUnloadedEvent(slot.getName(), slot.getVersion()));
        log.info("[{}] Unloaded", slot.getName());
    }

    /**
     * 帧边界同步 enabled 配置：ACTIVE <-> DISABLED
     */
    public void syncEnablement(PluginSlot slot) {
        boolean enabled = slot.getConfig().isEnabled();
        if (slot.getState() == PluginState.ACTIVE && !enabled) {
            transition(slot, PluginState.DISABLED);
        } else if (slot.getState() == PluginState.DISABLED && enabled) {
            transition(slot, PluginState.ACTIVE);
        }
    }

    // ==================== 内部方法 ====================

    void transition(PluginSlot slot, PluginState to) {
        PluginState from = slot.getState();
        if (from == to) {
            return;
        }
        slot.setState(to);
        log.debug("[{}] {} -> {}", slot.getName(), from, to);
        publish(new PluginStateChangedEvent(slot.getName(), slot.getVersion(), from, to));
    }

    private void cleanupInstance(PluginSlot slot) {
        TickPlugin instance = slot.getInstance();
        if (instance != null && slot.isInstanceInitialized()) {
            try {
                instance.cleanup();
            } catch (Throwable e) {
                rethrowIfFatal(e);
                log.error("[{}] Error in cleanup()", slot.getName(), e);
            }
        }
        slot.setInstance(null);
        slot.setInstanceInitialized(false);
    }

    private PluginFailure initFailure(FailureKind kind, String message, Throwable cause) {
        RuntimeException wrapped = kind == FailureKind.RELOAD
                ? new ReloadException(message, cause)
                : new InitializationException(message, cause);
        return PluginFailure.of(kind, message, wrapped);
    }

    /**
     * 插件代码抛出的 Error（NoClassDefFoundError、StackOverflowError、AssertionError 等）同样只让该插件失败，
     * 只有 JVM 自身无法继续运行的错误（OutOfMemoryError、InternalError）继续上抛
     */
    public static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }

    private void publish(TickFrameEvent event) {
        if (lifecycleEventBus != null) {
            lifecycleEventBus.publish(event);
        }
    }
}
