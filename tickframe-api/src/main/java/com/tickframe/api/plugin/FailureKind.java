package com.tickframe.api.plugin;

/**
 * 失败分类
 */
public enum FailureKind {
    CONFIGURATION,
    CIRCULAR_DEPENDENCY,
    MISSING_DEPENDENCY,
    INITIALIZATION,
    RUNTIME_FAULT,
    RELOAD
}
