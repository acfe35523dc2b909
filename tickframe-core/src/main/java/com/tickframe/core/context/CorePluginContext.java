package com.tickframe.core.context;

import com.tickframe.api.bus.DataBus;
import com.tickframe.api.context.PluginContext;
import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.core.bus.DefaultDataBus;
import com.tickframe.core.event.PluginEventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class CorePluginContext implements PluginContext {

    private final String pluginName;

    /**
     * 槽位持有的配置对象，热重载后仍是同一个
     */
    private final PluginConfig config;
    private final DefaultDataBus dataBus;
    private final PluginEventBus eventBus;

    @Override
    public String getPluginName() {
        return pluginName;
    }

    @Override
    public PluginConfig getConfig() {
        return config;
    }

    @Override
    public DataBus getDataBus() {
        return dataBus;
    }

    @Override
    public void postEvent(PluginEvent event) {
        eventBus.post(event.stamp(pluginName, dataBus.getCurrentTick()));
    }

    @Override
    public void provide(String key, Object value) {
        dataBus.provideAs(pluginName, key, value);
    }

    @Override
    public <T> T require(String key) {
        return dataBus.require(key, "Plugin '" + pluginName + "' requires '" + key + "' on the data bus. "
                + "Make sure the providing plugin is registered and declared as a dependency.");
    }
}
