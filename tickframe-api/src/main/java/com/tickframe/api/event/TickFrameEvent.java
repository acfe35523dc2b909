package com.tickframe.api.event;

/**
 * 面向宿主的框架事件标记接口
 */
public interface TickFrameEvent {
}
