package com.tickframe.api.plugin;

import com.tickframe.api.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Set;

/**
 * 插件静态描述：身份 + 数据契约
 * <p>
 * provides / consumes 是 DataBus 的键，dependencies 是必须先初始化成功的插件名。
 * 实例不可变，集合保持声明顺序。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
public final class PluginMetadata {

    private final String name;

    @Builder.Default
    private final String version = "1.0.0";

    private final String author;

    private final String description;

    // 本插件可能写入的键
    @Singular("provide")
    private final Set<String> provides;

    // 软依赖：希望读取的键，缺失时只返回默认值
    @Singular("consume")
    private final Set<String> consumes;

    // 硬依赖：插件名
    @Singular("dependency")
    private final Set<String> dependencies;

    public static PluginMetadata of(String name) {
        return builder().name(name).build();
    }

    /**
     * 注册前校验
     *
     * @throws ConfigurationException 元数据非法
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Plugin name cannot be blank");
        }
        if (version == null || version.isBlank()) {
            throw new ConfigurationException("Plugin [" + name + "] version cannot be blank");
        }
        checkKeys("provides", provides);
        checkKeys("consumes", consumes);
        checkKeys("dependencies", dependencies);
        if (dependencies.contains(name)) {
            throw new ConfigurationException("Plugin [" + name + "] cannot depend on itself");
        }
    }

    private void checkKeys(String field, Set<String> keys) {
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Plugin [" + name + "] declares a blank entry in " + field);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("PluginMetadata{name='%s', version='%s'}", name, version);
    }
}
