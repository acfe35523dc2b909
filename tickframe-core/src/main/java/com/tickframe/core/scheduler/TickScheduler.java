package com.tickframe.core.scheduler;

import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.frame.Frame;
import com.tickframe.core.bus.DefaultDataBus;
import com.tickframe.core.event.PluginEventBus;
import com.tickframe.core.plugin.PluginLifecycleManager;
import com.tickframe.core.plugin.PluginRegistry;
import com.tickframe.core.plugin.PluginSlot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 帧调度器
 * <p>
 * 单线程、协作式，一帧的顺序固定为：
 * 1. 同步 enabled 配置（ACTIVE <-> DISABLED）
 * 2. 按加载顺序 update
 * 3. 派发本帧 update 期间投递的事件
 * 4. 按 zIndex 顺序 render（由宿主单独调用）
 * </p>
 * 任一插件抛出的异常只让该插件进入 FAILED，本帧其余插件照常执行。
 */
@Slf4j
public class TickScheduler {

    private final PluginRegistry registry;
    private final PluginLifecycleManager lifecycleManager;
    private final DefaultDataBus dataBus;
    private final PluginEventBus eventBus;

    private List<String> loadOrder = List.of();
    private long currentTick = 0;

    // 是否正在回调插件代码
    private boolean dispatching = false;

    public TickScheduler(PluginRegistry registry,
                         PluginLifecycleManager lifecycleManager,
                         DefaultDataBus dataBus,
                         PluginEventBus eventBus) {
        this.registry = registry;
        this.lifecycleManager = lifecycleManager;
        this.dataBus = dataBus;
        this.eventBus = eventBus;
    }

    /**
     * 更新加载顺序（依赖解析完成后调用）
     */
    public void setLoadOrder(List<String> loadOrder) {
        this.loadOrder = List.copyOf(loadOrder);
    }

    public List<String> getLoadOrder() {
        return loadOrder;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public boolean isDispatching() {
        return dispatching;
    }

    // ==================== 帧 ====================

    /**
     * 执行一帧的逻辑阶段（update + 事件派发）
     *
     * @param deltaTime 外部时钟提供的秒数
     */
    public void runTick(double deltaTime) {
        currentTick++;
        dataBus.advanceTick(currentTick);

        List<PluginSlot> ordered = slotsInLoadOrder();
        for (PluginSlot slot : ordered) {
            lifecycleManager.syncEnablement(slot);
        }
        List<PluginSlot> updating = ordered.stream().filter(PluginSlot::isActive).toList();

        dispatching = true;
        try {
            for (PluginSlot slot : updating) {
                try {
                    slot.getInstance().update(deltaTime);
                } catch (Throwable e) {
                    lifecycleManager.fault(slot, "update()", e);
                }
            }
            deliverEvents(ordered);
        } finally {
            dispatching = false;
        }
        log.trace("Tick {} done: {} plugins updated", currentTick, updating.size());
    }

    /**
     * 派发当前队列中的事件给所有 ACTIVE 插件（加载顺序），与投递方无关
     */
    private void deliverEvents(List<PluginSlot> ordered) {
        List<PluginEvent> events = eventBus.drain();
        for (PluginEvent event : events) {
            for (PluginSlot slot : ordered) {
                if (!slot.isActive()) {
                    continue;
                }
                try {
                    slot.getInstance().handleEvent(event);
                } catch (Throwable e) {
                    lifecycleManager.fault(slot, "handleEvent(" + event.getType() + ")", e);
                }
            }
        }
    }

    /**
     * 渲染：帧依次穿过每个可见插件
     */
    public Frame render(Frame frame) {
        Frame current = frame;
        dispatching = true;
        try {
            for (PluginSlot slot : renderOrder()) {
                try {
                    Frame out = slot.getInstance().render(current);
                    if (out == null) {
                        throw new IllegalStateException("render() returned null");
                    }
                    current = out;
                } catch (Throwable e) {
                    lifecycleManager.fault(slot, "render()", e);
                }
            }
        } finally {
            dispatching = false;
        }
        return current;
    }

    /**
     * 渲染顺序：ACTIVE 且可见，zIndex 升序，相同时按加载顺序
     */
    public List<PluginSlot> renderOrder() {
        List<PluginSlot> visible = new ArrayList<>();
        for (PluginSlot slot : slotsInLoadOrder()) {
            if (slot.isActive() && slot.getConfig().isVisible()) {
                visible.add(slot);
            }
        }
        // List.sort 是稳定排序，平局保持加载顺序
        visible.sort(Comparator.comparingInt(s -> s.getConfig().getZIndex()));
        return visible;
    }

    /**
     * 按键派发：按加载顺序，第一个返回 true 的插件消费后停止
     *
     * @return 是否被消费
     */
    public boolean dispatchKey(String key) {
        dispatching = true;
        try {
            for (PluginSlot slot : slotsInLoadOrder()) {
                if (!slot.isActive()) {
                    continue;
                }
                try {
                    if (slot.getInstance().handleKey(key)) {
                        log.debug("[{}] Consumed key '{}'", slot.getName(), key);
                        return true;
                    }
                } catch (Throwable e) {
                    lifecycleManager.fault(slot, "handleKey(" + key + ")", e);
                }
            }
        } finally {
            dispatching = false;
        }
        log.debug("Key '{}' not consumed", key);
        return false;
    }

    private List<PluginSlot> slotsInLoadOrder() {
        List<PluginSlot> slots = new ArrayList<>(loadOrder.size());
        for (String name : loadOrder) {
            registry.find(name).ifPresent(slots::add);
        }
        return slots;
    }
}
