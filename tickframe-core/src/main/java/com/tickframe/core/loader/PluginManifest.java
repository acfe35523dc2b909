package com.tickframe.core.loader;

import lombok.Getter;
import lombok.Setter;

/**
 * 对应插件目录下的 plugin.yml
 */
@Getter
@Setter
public class PluginManifest {

    private String name;

    // 实现 PluginFactory 的入口类全限定名
    private String mainClass;

    /**
     * 验证
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Manifest name cannot be blank");
        }
        if (mainClass == null || mainClass.isBlank()) {
            throw new IllegalArgumentException("Manifest mainClass cannot be blank for plugin " + name);
        }
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{name='%s', mainClass='%s'}", name, mainClass);
    }
}
