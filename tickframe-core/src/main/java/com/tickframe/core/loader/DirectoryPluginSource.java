package com.tickframe.core.loader;

import com.tickframe.api.exception.TickFrameException;
import com.tickframe.api.plugin.PluginFactory;
import com.tickframe.core.classloader.PluginClassLoader;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 目录插件（exploded classes + plugin.yml）
 * <p>
 * 每次 load 都新建一个 Child-First 类加载器，旧加载器在新定义加载成功后关闭。
 * 调用方必须保证旧实例已 cleanup。
 * </p>
 */
@Slf4j
public class DirectoryPluginSource implements PluginSource {

    @Getter
    private final File directory;
    private final ClassLoader parent;

    @Getter
    private PluginManifest manifest;

    @Getter
    private PluginClassLoader currentLoader;

    public DirectoryPluginSource(File directory, ClassLoader parent) {
        if (!directory.isDirectory()) {
            throw new IllegalArgumentException("Invalid plugin directory: " + directory);
        }
        this.directory = directory;
        this.parent = parent;
    }

    public DirectoryPluginSource(File directory) {
        this(directory, DirectoryPluginSource.class.getClassLoader());
    }

    @Override
    public synchronized PluginFactory load() {
        // 每次都重新读取 manifest，mainClass 可能变化
        PluginManifest loaded = PluginManifestLoader.parse(directory);
        if (loaded == null) {
            throw new TickFrameException("No " + PluginManifestLoader.MANIFEST_FILE + " in " + directory);
        }

        PluginClassLoader loader;
        try {
            URL[] urls = new URL[]{directory.toURI().toURL()};
            loader = new PluginClassLoader(loaded.getName(), urls, parent);
        } catch (IOException e) {
            throw new TickFrameException("Failed to create classloader for " + directory.getName(), e);
        }

        PluginFactory factory;
        try {
            Class<?> mainClass = loader.loadClass(loaded.getMainClass());
            if (!PluginFactory.class.isAssignableFrom(mainClass)) {
                throw new TickFrameException(loaded.getMainClass() + " does not implement PluginFactory");
            }
            factory = (PluginFactory) mainClass.getDeclaredConstructor().newInstance();
        } catch (TickFrameException e) {
            closeQuietly(loader);
            throw e;
        } catch (Exception | LinkageError e) {
            closeQuietly(loader);
            throw new TickFrameException("Failed to instantiate " + loaded.getMainClass() + ": " + e.getMessage(), e);
        }

        PluginClassLoader previous = this.currentLoader;
        this.currentLoader = loader;
        this.manifest = loaded;
        if (previous != null) {
            closeQuietly(previous);
        }
        log.info("[{}] Loaded {} from {}", loaded.getName(), loaded.getMainClass(), directory.getName());
        return factory;
    }

    @Override
    public long lastModified() {
        try (Stream<Path> files = Files.walk(directory.toPath())) {
            return files.filter(Files::isRegularFile)
                    .mapToLong(p -> p.toFile().lastModified())
                    .max()
                    .orElse(0L);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String describe() {
        return directory.getAbsolutePath();
    }

    @Override
    public synchronized void close() {
        if (currentLoader != null) {
            closeQuietly(currentLoader);
            currentLoader = null;
        }
    }

    private void closeQuietly(PluginClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("[{}] Failed to close classloader", loader.getPluginName(), e);
        }
    }
}
