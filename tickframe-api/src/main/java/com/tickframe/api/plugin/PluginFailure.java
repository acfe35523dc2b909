package com.tickframe.api.plugin;

import java.util.List;

/**
 * 插件失败原因
 *
 * @param kind    分类
 * @param message 可读描述
 * @param cause   原始异常，可能为 null
 * @param related 相关插件名（环成员、缺失的依赖）
 */
public record PluginFailure(FailureKind kind, String message, Throwable cause, List<String> related) {

    public PluginFailure {
        related = related == null ? List.of() : List.copyOf(related);
    }

    public static PluginFailure of(FailureKind kind, String message) {
        return new PluginFailure(kind, message, null, List.of());
    }

    public static PluginFailure of(FailureKind kind, String message, Throwable cause) {
        return new PluginFailure(kind, message, cause, List.of());
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
