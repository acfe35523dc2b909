package com.tickframe.api.event;

/**
 * 宿主侧事件监听器
 *
 * @param <E> 监听的事件类型
 * @author TickFrame
 */
@FunctionalInterface
public interface LifecycleListener<E extends TickFrameEvent> {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(E event);
}
