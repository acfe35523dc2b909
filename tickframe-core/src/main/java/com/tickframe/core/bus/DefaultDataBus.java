package com.tickframe.core.bus;

import com.tickframe.api.bus.DataBus;
import com.tickframe.api.bus.DataEntry;
import com.tickframe.api.exception.MissingDependencyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 默认数据总线
 * <p>
 * 只在调度线程上访问，不加锁。
 * 生命周期与 PluginManager 一致，热重载和禁用都不会清理条目。
 * </p>
 */
@Slf4j
public class DefaultDataBus implements DataBus {

    private final Map<String, DataEntry> entries = new LinkedHashMap<>();

    // 当前帧号，由调度器在每帧开始时推进
    private long currentTick = 0;

    @Override
    public void provide(String key, Object value) {
        provideAs(null, key, value);
    }

    /**
     * 以指定插件身份写入
     */
    public void provideAs(String provider, String key, Object value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Data key cannot be empty");
        }
        entries.put(key, new DataEntry(value, currentTick, provider));
        log.trace("[{}] provide {} @tick {}", provider, key, currentTick);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key, T defaultValue) {
        DataEntry entry = entries.get(key);
        return entry != null ? (T) entry.value() : defaultValue;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T require(String key, String message) {
        DataEntry entry = entries.get(key);
        if (entry == null) {
            throw new MissingDependencyException(message != null ? message
                    : "Required data '" + key + "' is not available on the data bus");
        }
        return (T) entry.value();
    }

    @Override
    public <T> T require(String key) {
        return require(key, null);
    }

    @Override
    public Optional<DataEntry> getEntry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new HashMap<>();
        entries.forEach((k, v) -> copy.put(k, v.value()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 推进帧号（调度器专用）
     */
    public void advanceTick(long tick) {
        this.currentTick = tick;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public int size() {
        return entries.size();
    }

    /**
     * 清空（仅在运行时关闭时调用）
     */
    public void clear() {
        entries.clear();
    }
}
