package com.tickframe.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;

/**
 * 目录插件的类加载器
 * <p>
 * 插件自己的类 Child-First，热重载时整个加载器丢弃重建。
 * 插件与宿主之间传递的类型（JDK、TickFrame API、SLF4J 日志门面）必须由宿主加载，
 * 否则同名类在两侧不相等。
 * </p>
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    private static final List<String> SHARED_PREFIXES = List.of(
            "java.", "javax.", "jdk.", "sun.",
            "com.tickframe.api.",
            "org.slf4j."
    );

    @Getter
    private final String pluginName;

    @Getter
    private volatile boolean closed = false;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super(urls, parent);
        this.pluginName = pluginName;
    }

    /**
     * 是否必须由宿主加载
     */
    public static boolean isShared(String className) {
        for (String prefix : SHARED_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new IllegalStateException("ClassLoader of plugin [" + pluginName + "] is closed, cannot load " + name);
        }
        if (isShared(name)) {
            return super.loadClass(name, resolve);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                try {
                    c = findClass(name);
                } catch (ClassNotFoundException e) {
                    // 插件目录里没有，交给宿主（插件依赖的三方库）
                    return super.loadClass(name, resolve);
                }
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        URL local = findResource(name);
        return local != null ? local : super.getResource(name);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        super.close();
        log.debug("[{}] ClassLoader closed", pluginName);
    }
}
