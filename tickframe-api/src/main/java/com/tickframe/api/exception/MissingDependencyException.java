package com.tickframe.api.exception;

/**
 * 依赖缺失异常
 * <p>
 * 两种场景：
 * 1. 硬依赖的插件未注册或初始化失败
 * 2. {@code DataBus.require} 读取的键不存在
 * </p>
 *
 * @author TickFrame
 */
public class MissingDependencyException extends TickFrameException {

    public MissingDependencyException(String message) {
        super(message);
    }
}
