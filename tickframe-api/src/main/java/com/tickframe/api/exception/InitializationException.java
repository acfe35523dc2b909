package com.tickframe.api.exception;

/**
 * 插件 initialize() 返回 false 或抛出异常
 *
 * @author TickFrame
 */
public class InitializationException extends TickFrameException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
