package com.tickframe.api.exception;

/**
 * 插件元数据或配置非法
 * 抛出时插件不会被注册，其他插件的注册不受影响。
 *
 * @author TickFrame
 */
public class ConfigurationException extends TickFrameException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
