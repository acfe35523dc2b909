package com.tickframe.api.frame;

/**
 * 帧缓冲（不透明）
 * 由外部采集/合成模块提供，运行时只负责在插件之间传递，不解释其内容。
 */
public interface Frame {
}
