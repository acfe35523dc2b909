package com.tickframe.core.plugin;

import com.tickframe.api.exception.ConfigurationException;
import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.api.plugin.PluginFactory;
import com.tickframe.api.plugin.PluginMetadata;
import com.tickframe.core.loader.PluginSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 插件注册表：插件名 -> 槽位，保持注册顺序
 */
@Slf4j
public class PluginRegistry {

    private final Map<String, PluginSlot> slots = new LinkedHashMap<>();
    private int nextIndex = 0;

    /**
     * 注册
     *
     * @throws ConfigurationException 元数据非法或重名
     */
    public PluginSlot register(PluginSource source, PluginFactory factory, PluginConfig config) {
        PluginMetadata metadata = factory.metadata();
        if (metadata == null) {
            throw new ConfigurationException("Plugin from " + source.describe() + " exposes no metadata");
        }
        metadata.validate();
        if (slots.containsKey(metadata.getName())) {
            throw new ConfigurationException("Plugin name '" + metadata.getName() + "' is already registered");
        }

        PluginSlot slot = new PluginSlot(metadata.getName(), nextIndex++, source, factory,
                config != null ? config : PluginConfig.defaults());
        slots.put(slot.getName(), slot);
        log.debug("[{}] Registered at index {}", slot.getName(), slot.getRegistrationIndex());
        return slot;
    }

    public Optional<PluginSlot> find(String name) {
        return Optional.ofNullable(slots.get(name));
    }

    /**
     * @throws IllegalArgumentException 插件不存在
     */
    public PluginSlot get(String name) {
        PluginSlot slot = slots.get(name);
        if (slot == null) {
            throw new IllegalArgumentException("Plugin not found: " + name);
        }
        return slot;
    }

    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    PluginSlot remove(String name) {
        return slots.remove(name);
    }

    /**
     * 按注册顺序返回所有槽位
     */
    public List<PluginSlot> all() {
        return new ArrayList<>(slots.values());
    }

    public int size() {
        return slots.size();
    }
}
