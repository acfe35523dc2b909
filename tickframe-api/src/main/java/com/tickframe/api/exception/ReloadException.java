package com.tickframe.api.exception;

/**
 * 热重载失败：新定义无法加载或初始化，旧实例不会被恢复
 *
 * @author TickFrame
 */
public class ReloadException extends TickFrameException {

    public ReloadException(String message) {
        super(message);
    }

    public ReloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
