package com.tickframe.api.bus;

import com.tickframe.api.exception.MissingDependencyException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 插件间共享的键值数据总线
 * <p>
 * 每个键只保留最后一次写入的值（last-write-wins），没有历史也没有队列。
 * 单线程访问，写入对本帧后续所有读取立即可见。
 * </p>
 *
 * @author TickFrame
 */
public interface DataBus {

    /**
     * 无条件写入
     */
    void provide(String key, Object value);

    /**
     * 读取当前值，不存在时返回默认值，永不失败
     */
    <T> T get(String key, T defaultValue);

    /**
     * 读取当前值，不存在时抛出异常
     *
     * @param message 异常描述
     * @throws MissingDependencyException 键不存在
     */
    <T> T require(String key, String message);

    /**
     * 同 {@link #require(String, String)}，使用默认描述
     */
    <T> T require(String key);

    /**
     * 读取完整条目（值 + 帧号 + 写入方）
     */
    Optional<DataEntry> getEntry(String key);

    boolean contains(String key);

    Set<String> keys();

    /**
     * 当前所有值的只读副本
     */
    Map<String, Object> snapshot();
}
