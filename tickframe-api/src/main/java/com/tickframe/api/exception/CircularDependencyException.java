package com.tickframe.api.exception;

import java.util.List;

/**
 * 硬依赖成环
 *
 * @author TickFrame
 */
public class CircularDependencyException extends TickFrameException {

    private final List<String> members;

    public CircularDependencyException(List<String> members) {
        super("Circular dependency detected among plugins: " + String.join(", ", members));
        this.members = List.copyOf(members);
    }

    /**
     * 环上的全部插件名（按注册顺序）
     */
    public List<String> getMembers() {
        return members;
    }
}
