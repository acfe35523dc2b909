package com.tickframe.api.bus;

/**
 * DataBus 条目
 *
 * @param value    最后写入的值
 * @param tick     写入时的帧号
 * @param provider 写入方插件名，宿主写入时为 null
 */
public record DataEntry(Object value, long tick, String provider) {
}
