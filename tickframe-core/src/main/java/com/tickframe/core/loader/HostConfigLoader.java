package com.tickframe.core.loader;

import com.tickframe.api.exception.ConfigurationException;
import com.tickframe.api.plugin.PluginConfig;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 宿主插件配置加载
 * <pre>
 * plugins:
 *   - name: GpsProvider
 *     enabled: true
 *     visible: false
 *     z_index: 10
 *     settings:
 *       port: /dev/ttyUSB0
 * </pre>
 * 列表顺序即注册顺序。顶层的 enabled / visible / z_index 覆盖 settings 中的同名项。
 */
@Slf4j
public class HostConfigLoader {

    /**
     * 读取配置文件，文件不存在时返回空列表
     *
     * @throws ConfigurationException YAML 语法错误或条目非法
     */
    public static List<PluginEntry> load(File file) {
        if (!file.isFile()) {
            log.warn("Host config {} not found, using defaults", file.getAbsolutePath());
            return List.of();
        }
        try (InputStream in = new FileInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read host config " + file.getAbsolutePath(), e);
        }
    }

    public static List<PluginEntry> load(InputStream inputStream) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed host config: " + e.getMessage(), e);
        }
        if (root == null) {
            return List.of();
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            throw new ConfigurationException("Host config root must be a mapping");
        }
        Object plugins = rootMap.get("plugins");
        if (plugins == null) {
            return List.of();
        }
        if (!(plugins instanceof List<?> list)) {
            throw new ConfigurationException("'plugins' must be a list");
        }

        List<PluginEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> data)) {
                throw new ConfigurationException("Plugin entry must be a mapping: " + item);
            }
            PluginEntry entry = toEntry(data);
            if (!seen.add(entry.name())) {
                throw new ConfigurationException("Duplicate plugin entry: " + entry.name());
            }
            entries.add(entry);
        }
        return entries;
    }

    private static PluginEntry toEntry(Map<?, ?> data) {
        Object name = data.get("name");
        if (!(name instanceof String pluginName) || pluginName.isBlank()) {
            throw new ConfigurationException("Plugin entry is missing a name: " + data);
        }

        PluginConfig config = PluginConfig.defaults();

        // 先合并 settings
        Object settings = data.get("settings");
        if (settings instanceof Map<?, ?> map) {
            map.forEach((k, v) -> config.getSettings().put(String.valueOf(k), v));
        } else if (settings != null) {
            throw new ConfigurationException("[" + pluginName + "] settings must be a mapping");
        }

        // 再应用顶层覆盖
        config.setEnabled(bool(pluginName, data, "enabled", true));
        config.setVisible(bool(pluginName, data, "visible", true));
        config.getSettings().put("visible", config.isVisible());

        Object z = data.get("z_index");
        if (z != null) {
            if (!(z instanceof Integer zIndex)) {
                throw new ConfigurationException("[" + pluginName + "] z_index must be an integer: " + z);
            }
            config.setZIndex(zIndex);
        }
        return new PluginEntry(pluginName, config);
    }

    private static boolean bool(String pluginName, Map<?, ?> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean b)) {
            throw new ConfigurationException("[" + pluginName + "] " + key + " must be a boolean: " + value);
        }
        return b;
    }
}
