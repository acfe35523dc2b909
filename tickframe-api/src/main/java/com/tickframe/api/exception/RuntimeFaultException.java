package com.tickframe.api.exception;

/**
 * 插件在 update / render / handleEvent / handleKey 中抛出的异常
 *
 * @author TickFrame
 */
public class RuntimeFaultException extends TickFrameException {

    public RuntimeFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
