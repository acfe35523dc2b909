package com.tickframe.api.event;

import lombok.Getter;

/**
 * 插件间临时通知
 * 与 DataBus 相互独立：事件只派发一次，不保留
 */
@Getter
public final class PluginEvent {

    private final String type;
    private final Object payload;

    // 投递方插件名，宿主投递时为 null
    private final String source;

    // 投递时的帧号，未投递时为 -1
    private final long tick;

    public PluginEvent(String type, Object payload, String source, long tick) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        this.type = type;
        this.payload = payload;
        this.source = source;
        this.tick = tick;
    }

    public static PluginEvent of(String type, Object payload) {
        return new PluginEvent(type, payload, null, -1);
    }

    /**
     * 盖上投递方和帧号
     */
    public PluginEvent stamp(String source, long tick) {
        return new PluginEvent(type, payload, source, tick);
    }

    public boolean is(String type) {
        return this.type.equals(type);
    }

    @SuppressWarnings("unchecked")
    public <T> T payload() {
        return (T) payload;
    }

    @Override
    public String toString() {
        return "PluginEvent[type=" + type + ", source=" + source + ", tick=" + tick + "]";
    }
}
