package com.tickframe.core.loader;

import com.tickframe.api.exception.TickFrameException;
import com.tickframe.api.plugin.PluginFactory;

import java.util.function.Supplier;

/**
 * 内存中的插件定义
 * 热重载会拿到 supplier 当前提供的定义并重新构造实例
 */
public class FactoryPluginSource implements PluginSource {

    private final Supplier<PluginFactory> supplier;

    public FactoryPluginSource(PluginFactory factory) {
        this(() -> factory);
    }

    public FactoryPluginSource(Supplier<PluginFactory> supplier) {
        this.supplier = supplier;
    }

    @Override
    public PluginFactory load() {
        PluginFactory factory = supplier.get();
        if (factory == null) {
            throw new TickFrameException("Plugin factory supplier returned null");
        }
        return factory;
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
