package com.tickframe.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 框架事件基类
 */
@Getter
public abstract class AbstractTickFrameEvent implements TickFrameEvent, Serializable {
    private final long timestamp;

    public AbstractTickFrameEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[timestamp=" + timestamp + "]";
    }
}
