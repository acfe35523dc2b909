package com.tickframe.core.event;

import com.tickframe.api.event.PluginEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 插件事件总线（帧内队列）
 * <p>
 * 特点：
 * - post 只入队，不立即派发
 * - 每帧所有 update 结束后由调度器统一 drain 并派发
 * - 有界队列，满时丢弃最旧的事件
 * </p>
 */
@Slf4j
public class PluginEventBus {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<PluginEvent> outgoing = new ArrayDeque<>();
    private long droppedCount = 0;

    public PluginEventBus() {
        this(DEFAULT_CAPACITY);
    }

    public PluginEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * 投递事件（追加到本帧出队列）
     */
    public void post(PluginEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (outgoing.size() >= capacity) {
            PluginEvent dropped = outgoing.pollFirst();
            droppedCount++;
            log.warn("Event queue full ({}), dropping oldest event: {}", capacity, dropped);
        }
        outgoing.addLast(event);
        log.debug("Queued event {} from {}", event.getType(), event.getSource());
    }

    /**
     * 取出当前队列中的全部事件并清空
     * 派发过程中新投递的事件留到下一帧
     */
    public List<PluginEvent> drain() {
        if (outgoing.isEmpty()) {
            return List.of();
        }
        List<PluginEvent> events = new ArrayList<>(outgoing);
        outgoing.clear();
        return events;
    }

    public int getPendingCount() {
        return outgoing.size();
    }

    public long getDroppedCount() {
        return droppedCount;
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        outgoing.clear();
    }
}
