package com.tickframe.api.exception;

/**
 * TickFrame 基础异常
 *
 * @author TickFrame
 */
public class TickFrameException extends RuntimeException {

    public TickFrameException(String message) {
        super(message);
    }

    public TickFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
