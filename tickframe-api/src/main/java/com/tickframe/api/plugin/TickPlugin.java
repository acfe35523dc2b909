package com.tickframe.api.plugin;

import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.frame.Frame;

/**
 * 插件生命周期接口
 * 每个插件实例在构造时拿到 {@link com.tickframe.api.context.PluginContext}，之后由调度器逐帧驱动。
 * <p>
 * 所有回调都在同一个调度线程上执行，插件之间不会并发。
 * 需要阻塞 IO 的插件应自行在外部线程完成，再把结果写入 DataBus。
 * </p>
 *
 * @author TickFrame
 */
public interface TickPlugin {

    /**
     * 初始化
     *
     * @return false 表示初始化失败，插件进入 FAILED
     */
    boolean initialize();

    /**
     * 每帧逻辑，按加载顺序调用
     *
     * @param deltaTime 距上一帧的秒数，由外部时钟提供
     */
    void update(double deltaTime);

    /**
     * 每帧渲染，按 zIndex 顺序调用
     *
     * @param frame 上一个插件处理后的帧
     * @return 处理后的帧（可以是同一个对象）
     */
    Frame render(Frame frame);

    /**
     * 接收本帧 update 阶段投递的事件
     */
    default void handleEvent(PluginEvent event) {
        // Default empty implementation
    }

    /**
     * 处理按键
     *
     * @return true 表示已消费，后续插件不再收到
     */
    default boolean handleKey(String key) {
        return false;
    }

    /**
     * 卸载或重载前释放资源
     */
    default void cleanup() {
        // Default empty implementation
    }
}
