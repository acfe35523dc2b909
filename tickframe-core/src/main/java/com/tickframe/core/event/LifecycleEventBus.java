package com.tickframe.core.event;

import com.tickframe.api.event.LifecycleListener;
import com.tickframe.api.event.TickFrameEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 面向宿主的生命周期事件总线
 * <p>
 * 同步派发；订阅父类型可收到所有子类型事件。
 * 监听器异常只记录日志，不影响调度。
 * </p>
 */
@Slf4j
public class LifecycleEventBus {

    private final Map<Class<? extends TickFrameEvent>, List<Registration<?>>> listeners =
            new ConcurrentHashMap<>();

    /**
     * 订阅事件
     *
     * @param owner 订阅方标识，用于 {@link #unsubscribeAll(String)}
     */
    public <E extends TickFrameEvent> Subscription subscribe(String owner, Class<E> eventType, LifecycleListener<E> listener) {
        Registration<E> registration = new Registration<>(owner, listener);
        List<Registration<?>> list = listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        list.add(registration);
        return () -> list.remove(registration);
    }

    public <E extends TickFrameEvent> Subscription subscribe(Class<E> eventType, LifecycleListener<E> listener) {
        return subscribe("host", eventType, listener);
    }

    /**
     * 移除某个订阅方的所有监听
     */
    public void unsubscribeAll(String owner) {
        listeners.values().forEach(list -> list.removeIf(r -> r.owner().equals(owner)));
    }

    @SuppressWarnings("unchecked")
    public void publish(TickFrameEvent event) {
        for (Map.Entry<Class<? extends TickFrameEvent>, List<Registration<?>>> entry : listeners.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (Registration<?> registration : entry.getValue()) {
                try {
                    ((LifecycleListener<TickFrameEvent>) registration.listener()).onEvent(event);
                } catch (Exception e) {
                    log.error("Lifecycle listener of [{}] failed on {}: {}",
                            registration.owner(), event.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }

    public int getSubscriptionCount() {
        return listeners.values().stream().mapToInt(List::size).sum();
    }

    /**
     * 订阅句柄（用于取消订阅）
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Registration<E extends TickFrameEvent>(String owner, LifecycleListener<E> listener) {
    }
}
