package com.tickframe.core.loader;

import com.tickframe.api.exception.ConfigurationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

public class PluginManifestLoader {

    public static final String MANIFEST_FILE = "plugin.yml";

    public static PluginManifest load(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        // 根对象固定为 PluginManifest，不需要额外 tag
        options.setTagInspector(tag -> false);

        Constructor constructor = new Constructor(PluginManifest.class, options);
        Yaml yaml = new Yaml(constructor);

        PluginManifest manifest = yaml.load(inputStream);
        if (manifest == null) {
            throw new ConfigurationException("Empty plugin manifest");
        }
        return manifest;
    }

    /**
     * 解析插件目录下的 plugin.yml
     *
     * @return 不是插件目录时返回 null
     */
    public static PluginManifest parse(File pluginDir) {
        File yml = new File(pluginDir, MANIFEST_FILE);
        if (!yml.isFile()) {
            return null;
        }
        try (InputStream in = new FileInputStream(yml)) {
            PluginManifest manifest = load(in);
            manifest.validate();
            return manifest;
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Invalid manifest " + yml.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
