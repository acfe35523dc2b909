package com.tickframe.core.plugin;

import com.tickframe.api.event.PluginEvent;
import com.tickframe.api.event.lifecycle.PluginFailedEvent;
import com.tickframe.api.event.lifecycle.PluginRegisteredEvent;
import com.tickframe.api.event.lifecycle.PluginUnloadedEvent;
import com.tickframe.api.exception.ConfigurationException;
import com.tickframe.api.exception.InitializationException;
import com.tickframe.api.exception.MissingDependencyException;
import com.tickframe.api.exception.RuntimeFaultException;
import com.tickframe.api.plugin.FailureKind;
import com.tickframe.api.plugin.PluginConfig;
import com.tickframe.api.plugin.PluginFailure;
import com.tickframe.api.plugin.PluginMetadata;
import com.tickframe.api.plugin.PluginState;
import com.tickframe.core.support.TestFrame;
import com.tickframe.core.support.TestPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginManager 单元测试")
public class PluginManagerTest {

    private List<String> journal;
    private PluginManager manager;

    @BeforeEach
    void setUp() {
        journal = new ArrayList<>();
        manager = new PluginManager();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    // ==================== 辅助方法 ====================

    private TestPlugin plugin(String name) {
        return TestPlugin.of(name, journal);
    }

    private TestPlugin plugin(PluginMetadata metadata) {
        return new TestPlugin(metadata, journal);
    }

    private TestPlugin dependent(String name, String... dependencies) {
        PluginMetadata.PluginMetadataBuilder builder = PluginMetadata.builder().name(name);
        for (String dep : dependencies) {
            builder.dependency(dep);
        }
        return plugin(builder.build());
    }

    private PluginConfig z(int zIndex) {
        return PluginConfig.builder().zIndex(zIndex).build();
    }

    private List<String> journalOf(String suffix) {
        return journal.stream().filter(e -> e.endsWith(suffix)).toList();
    }

    // ==================== 注册 ====================

    @Nested
    @DisplayName("注册校验")
    class RegistrationTests {

        @Test
        @DisplayName("重名注册被拒绝，已注册的插件不受影响")
        void duplicateNameRejected() {
            manager.register(plugin("Gps"));

            assertThrows(ConfigurationException.class, () -> manager.register(plugin("Gps")));
            assertEquals(1, manager.listPlugins().size());
        }

        @Test
        @DisplayName("依赖自己被拒绝")
        void selfDependencyRejected() {
            assertThrows(ConfigurationException.class, () -> manager.register(dependent("Loop", "Loop")));
            assertFalse(manager.isRegistered("Loop"));
        }

        @Test
        @DisplayName("空名与空键被拒绝")
        void blankNamesRejected() {
            assertThrows(ConfigurationException.class, () -> manager.register(plugin(" ")));
            assertThrows(ConfigurationException.class,
                    () -> manager.register(plugin(PluginMetadata.builder().name("Bad").provide("").build())));
        }

        @Test
        @DisplayName("注册发布 PluginRegisteredEvent")
        void registrationPublishesEvent() {
            List<String> registered = new ArrayList<>();
            manager.getLifecycleEventBus().subscribe(PluginRegisteredEvent.class, e -> registered.add(e.getPluginName()));

            manager.register(plugin("A"));
            manager.register(plugin("B"));

            assertEquals(List.of("A", "B"), registered);
            assertEquals(PluginState.UNRESOLVED, manager.getState("A"));
        }

        @Test
        @DisplayName("查询不存在的插件抛出 IllegalArgumentException")
        void unknownPlugin() {
            assertThrows(IllegalArgumentException.class, () -> manager.getState("Nope"));
        }
    }

    // ==================== 初始化 ====================

    @Nested
    @DisplayName("初始化")
    class InitializationTests {

        @Test
        @DisplayName("initialize 返回 false 的插件失败，其余正常")
        void initializeFalseFails() {
            manager.register(plugin("Bad").onInit(ctx -> false));
            manager.register(plugin("Good"));

            manager.start();

            assertEquals(PluginState.FAILED, manager.getState("Bad"));
            assertEquals(FailureKind.INITIALIZATION, manager.getFailure("Bad").orElseThrow().kind());
            assertEquals(PluginState.ACTIVE, manager.getState("Good"));
            assertEquals(List.of("Good"), manager.getLoadOrder());
        }

        @Test
        @DisplayName("initialize 抛出异常同样转为 FAILED，不向外传播")
        void initializeThrowsFails() {
            manager.register(plugin("Bad").onInit(ctx -> {
                throw new IllegalStateException("camera not found");
            }));

            assertDoesNotThrow(() -> manager.start());

            PluginFailure failure = manager.getFailure("Bad").orElseThrow();
            assertEquals(FailureKind.INITIALIZATION, failure.kind());
            assertInstanceOf(InitializationException.class, failure.cause());
            assertTrue(failure.message().contains("camera not found"));
        }

        @Test
        @DisplayName("initialize 抛出 Error 只让该插件失败，后续插件照常初始化")
        void initializeErrorIsolated() {
            manager.register(plugin("Broken").onInit(ctx -> {
                throw new NoClassDefFoundError("com/example/Gone");
            }));
            manager.register(plugin("Good"));

            assertDoesNotThrow(() -> manager.start());

            assertEquals(PluginState.FAILED, manager.getState("Broken"));
            PluginFailure failure = manager.getFailure("Broken").orElseThrow();
            assertEquals(FailureKind.INITIALIZATION, failure.kind());
            assertInstanceOf(NoClassDefFoundError.class, failure.cause().getCause());
            assertEquals(PluginState.ACTIVE, manager.getState("Good"));
        }

        @Test
        @DisplayName("JVM 级错误不被吞掉")
        void fatalErrorPropagates() {
            manager.register(plugin("Hungry").onInit(ctx -> {
                throw new OutOfMemoryError("simulated");
            }));

            assertThrows(OutOfMemoryError.class, () -> manager.start());
        }

        @Test
        @DisplayName("硬依赖初始化失败，依赖方不会被构造")
        void dependencyInitFailureCascades() {
            TestPlugin camera = plugin("Camera").onInit(ctx -> false);
            TestPlugin detector = dependent("Detector", "Camera");
            manager.register(detector);
            manager.register(camera);

            manager.start();

            assertEquals(PluginState.FAILED, manager.getState("Detector"));
            assertEquals(FailureKind.MISSING_DEPENDENCY, manager.getFailure("Detector").orElseThrow().kind());
            assertEquals(0, detector.getCreatedCount());
        }

        @Test
        @DisplayName("依赖未注册的 Ghost：X 与依赖 X 的插件失败，无关插件运行")
        void ghostDependency() {
            manager.register(dependent("X", "Ghost"));
            manager.register(dependent("Y", "X"));
            manager.register(plugin("Z"));

            manager.start();
            manager.tick(0.016);

            assertEquals(FailureKind.MISSING_DEPENDENCY, manager.getFailure("X").orElseThrow().kind());
            assertEquals(FailureKind.MISSING_DEPENDENCY, manager.getFailure("Y").orElseThrow().kind());
            assertEquals(List.of("Z.update"), journalOf(".update"));
        }

        @Test
        @DisplayName("A<->B 成环：两者失败，第三个插件正常运行")
        void cycleDoesNotBlockOthers() {
            manager.register(dependent("CircularA", "CircularB"));
            manager.register(dependent("CircularB", "CircularA"));
            manager.register(plugin("Independent"));

            manager.start();
            manager.tick(0.016);

            assertEquals(FailureKind.CIRCULAR_DEPENDENCY, manager.getFailure("CircularA").orElseThrow().kind());
            assertEquals(FailureKind.CIRCULAR_DEPENDENCY, manager.getFailure("CircularB").orElseThrow().kind());
            assertEquals(List.of(List.of("CircularA", "CircularB")), manager.getLastResolution().cycles());
            assertEquals(List.of("Independent.update"), journalOf(".update"));
        }

        @Test
        @DisplayName("失败时发布 PluginFailedEvent")
        void failurePublishesEvent() {
            List<PluginFailedEvent> failed = new ArrayList<>();
            manager.getLifecycleEventBus().subscribe(PluginFailedEvent.class, failed::add);
            manager.register(dependent("X", "Ghost"));

            manager.start();

            assertEquals(1, failed.size());
            assertEquals("X", failed.get(0).getPluginName());
        }

        @Test
        @DisplayName("配置为禁用的插件初始化后进入 DISABLED")
        void disabledPluginInitializes() {
            TestPlugin hud = plugin("Hud");
            manager.register(hud, PluginConfig.builder().enabled(false).build());

            manager.start();
            manager.tick(0.016);

            assertEquals(PluginState.DISABLED, manager.getState("Hud"));
            assertTrue(journalOf(".update").isEmpty());
            assertEquals(1, hud.getCreatedCount());
        }

        @Test
        @DisplayName("启动后注册的插件在下一帧边界初始化")
        void lateRegistration() {
            manager.start();
            manager.register(plugin("Late"));

            assertEquals(PluginState.UNRESOLVED, manager.getState("Late"));
            manager.tick(0.016);

            assertEquals(PluginState.ACTIVE, manager.getState("Late"));
            assertEquals(List.of("Late.init", "Late.update"), journal);
        }
    }

    // ==================== 帧驱动 ====================

    @Nested
    @DisplayName("update 与数据总线")
    class UpdateTests {

        @Test
        @DisplayName("提供方写入的数据对同一帧后续插件可见")
        void provideVisibleLaterInSameTick() {
            List<Object> seen = new ArrayList<>();
            manager.register(plugin(PluginMetadata.builder().name("Nav").consume("pos").build())
                    .onUpdate((ctx, dt) -> seen.add(ctx.get("pos", null))));
            manager.register(plugin(PluginMetadata.builder().name("Gps").provide("pos").build())
                    .onUpdate((ctx, dt) -> ctx.provide("pos", "fix-" + manager.getCurrentTick())));

            manager.start();
            manager.tick(0.016);
            manager.tick(0.016);

            assertEquals(List.of("Gps", "Nav"), manager.getLoadOrder());
            assertEquals(List.of("fix-1", "fix-2"), seen);
        }

        @Test
        @DisplayName("软依赖没有提供方时每帧读到默认值")
        void softDependencyDefault() {
            List<Object> seen = new ArrayList<>();
            manager.register(plugin(PluginMetadata.builder().name("Nav").consume("pos").build())
                    .onUpdate((ctx, dt) -> seen.add(ctx.get("pos", "unknown"))));

            manager.start();
            for (int i = 0; i < 3; i++) {
                manager.tick(0.016);
            }

            assertEquals(List.of("unknown", "unknown", "unknown"), seen);
            assertEquals(PluginState.ACTIVE, manager.getState("Nav"));
        }

        @Test
        @DisplayName("已执行的插件看不到同一帧后面插件写入的数据")
        void noRevisitWithinTick() {
            List<Object> seen = new ArrayList<>();
            manager.register(plugin("Early").onUpdate((ctx, dt) -> seen.add(ctx.get("late.value", null))));
            manager.register(plugin("Late").onUpdate((ctx, dt) -> ctx.provide("late.value", manager.getCurrentTick())));

            manager.start();
            manager.tick(0.016);
            manager.tick(0.016);

            assertEquals(List.of("Early", "Late"), manager.getLoadOrder());
            assertNull(seen.get(0));
            assertEquals(1L, seen.get(1));
        }

        @Test
        @DisplayName("deltaTime 原样传入，帧号递增")
        void deltaTimeAndTick() {
            List<Double> deltas = new ArrayList<>();
            manager.register(plugin("Clock").onUpdate((ctx, dt) -> deltas.add(dt)));

            manager.start();
            manager.tick(0.5);
            manager.tick(0.25);

            assertEquals(List.of(0.5, 0.25), deltas);
            assertEquals(2, manager.getCurrentTick());
        }

        @Test
        @DisplayName("update 抛异常只让该插件失败，且不再重试")
        void updateFaultIsolated() {
            manager.register(plugin("Bad").onUpdate((ctx, dt) -> {
                throw new IllegalStateException("update boom");
            }));
            manager.register(plugin("Good"));

            manager.start();
            manager.tick(0.016);
            manager.tick(0.016);
            manager.tick(0.016);

            assertEquals(1, Collections.frequency(journal, "Bad.update"));
            assertEquals(3, Collections.frequency(journal, "Good.update"));
            PluginFailure failure = manager.getFailure("Bad").orElseThrow();
            assertEquals(FailureKind.RUNTIME_FAULT, failure.kind());
            assertInstanceOf(RuntimeFaultException.class, failure.cause());
        }

        @Test
        @DisplayName("update 抛出 Error 同样只让该插件失败，后续插件本帧照常执行")
        void updateErrorIsolated() {
            manager.register(plugin("Broken").onUpdate((ctx, dt) -> {
                throw new NoClassDefFoundError("com/example/Gone");
            }));
            manager.register(plugin("Deep").onUpdate((ctx, dt) -> {
                throw new StackOverflowError();
            }));
            manager.register(plugin("Good"));

            manager.start();
            assertDoesNotThrow(() -> manager.tick(0.016));
            manager.tick(0.016);

            assertEquals(PluginState.FAILED, manager.getState("Broken"));
            assertEquals(PluginState.FAILED, manager.getState("Deep"));
            assertInstanceOf(NoClassDefFoundError.class, manager.getFailure("Broken").orElseThrow().cause().getCause());
            assertEquals(2, Collections.frequency(journal, "Good.update"));
        }

        @Test
        @DisplayName("render、事件、按键中抛出 Error 只让该插件失败")
        void callbackErrorsIsolated() {
            manager.register(plugin("Painter").onRender((ctx, frame) -> {
                throw new AssertionError("bad frame");
            }));
            manager.register(plugin("Listener").onEvent((ctx, e) -> {
                throw new LinkageError("event class mismatch");
            }));
            manager.register(plugin("Keys").onKey((ctx, key) -> {
                throw new ExceptionInInitializerError("static init");
            }));
            manager.register(plugin("Good"));

            manager.start();
            manager.postEvent("ping", null);
            manager.tick(0.016);
            TestFrame frame = new TestFrame();
            assertDoesNotThrow(() -> manager.render(frame));
            assertFalse(manager.dispatchKey("q"));

            assertEquals(PluginState.FAILED, manager.getState("Painter"));
            assertEquals(PluginState.FAILED, manager.getState("Listener"));
            assertEquals(PluginState.FAILED, manager.getState("Keys"));
            assertEquals(PluginState.ACTIVE, manager.getState("Good"));
            assertTrue(frame.getLayers().contains("Good"));
        }

        @Test
        @DisplayName("update 中 require 缺失数据视为运行时故障")
        void requireMissingIsRuntimeFault() {
            manager.register(plugin("Needy").onUpdate((ctx, dt) -> ctx.require("gps.fix")));

            manager.start();
            manager.tick(0.016);

            PluginFailure failure = manager.getFailure("Needy").orElseThrow();
            assertEquals(FailureKind.RUNTIME_FAULT, failure.kind());
            assertInstanceOf(MissingDependencyException.class, failure.cause().getCause());
            assertTrue(failure.message().contains("gps.fix"));
        }

        @Test
        @DisplayName("插件回调中不能结构性修改运行时")
        void structuralChangeDuringTickRejected() {
            manager.register(plugin("Other"));
            manager.register(plugin("Rogue").onUpdate((ctx, dt) -> manager.unregister("Other")));

            manager.start();
            manager.tick(0.016);

            assertEquals(PluginState.FAILED, manager.getState("Rogue"));
            assertInstanceOf(IllegalStateException.class, manager.getFailure("Rogue").orElseThrow().cause().getCause());
            assertEquals(PluginState.ACTIVE, manager.getState("Other"));
        }

        @Test
        @DisplayName("未启动时 tick 抛出 IllegalStateException")
        void tickBeforeStart() {
            assertThrows(IllegalStateException.class, () -> manager.tick(0.016));
        }
    }

    // ==================== 事件 ====================

    @Nested
    @DisplayName("事件派发")
    class EventTests {

        @Test
        @DisplayName("所有 update 结束后按加载顺序派发给所有 ACTIVE 插件，包括投递方")
        void deliveredAfterUpdates() {
            manager.register(plugin("A").onUpdate((ctx, dt) -> ctx.postEvent("obstacle", 3)));
            manager.register(plugin("B"));

            manager.start();
            manager.tick(0.016);

            assertEquals(List.of("A.init", "B.init", "A.update", "B.update", "A.event:obstacle", "B.event:obstacle"),
                    journal);
        }

        @Test
        @DisplayName("事件携带投递方与帧号")
        void eventIsStamped() {
            TestPlugin receiver = plugin("Receiver");
            manager.register(plugin("Sender").onUpdate((ctx, dt) -> ctx.postEvent("ping", "payload")));
            manager.register(receiver);

            manager.start();
            manager.tick(0.016);

            PluginEvent event = receiver.getReceivedEvents().get(0);
            assertEquals("Sender", event.getSource());
            assertEquals(1, event.getTick());
            assertEquals("payload", event.payload());
        }

        @Test
        @DisplayName("派发期间投递的事件留到下一帧")
        void postedDuringDeliveryWaits() {
            TestPlugin echo = plugin("Echo").onEvent((ctx, e) -> {
                if (e.is("ping")) {
                    ctx.postEvent("pong", null);
                }
            });
            manager.register(echo);

            manager.start();
            manager.postEvent("ping", null);
            manager.tick(0.016);

            assertEquals(List.of("ping"), echo.getReceivedEvents().stream().map(PluginEvent::getType).toList());
            manager.tick(0.016);
            assertEquals(List.of("ping", "pong"), echo.getReceivedEvents().stream().map(PluginEvent::getType).toList());
        }

        @Test
        @DisplayName("禁用插件收不到事件")
        void disabledPluginSkipped() {
            TestPlugin muted = plugin("Muted");
            manager.register(plugin("Sender").onUpdate((ctx, dt) -> ctx.postEvent("ping", null)));
            manager.register(muted, PluginConfig.builder().enabled(false).build());

            manager.start();
            manager.tick(0.016);

            assertTrue(muted.getReceivedEvents().isEmpty());
        }

        @Test
        @DisplayName("handleEvent 抛异常只让该插件失败")
        void handleEventFault() {
            TestPlugin after = plugin("After");
            manager.register(plugin("Fragile").onEvent((ctx, e) -> {
                throw new IllegalArgumentException("bad payload");
            }));
            manager.register(after);

            manager.start();
            manager.postEvent("ping", null);
            manager.tick(0.016);

            assertEquals(FailureKind.RUNTIME_FAULT, manager.getFailure("Fragile").orElseThrow().kind());
            assertEquals(1, after.getReceivedEvents().size());
        }
    }

    // ==================== 渲染 ====================

    @Nested
    @DisplayName("渲染")
    class RenderTests {

        @Test
        @DisplayName("加载顺序 [C,A,B]，zIndex A=10 B=5 C=20，渲染顺序 [B,A,C]")
        void renderOrderByZIndex() {
            manager.register(plugin("C"), z(20));
            manager.register(plugin("A"), z(10));
            manager.register(plugin("B"), z(5));

            manager.start();
            manager.tick(0.016);
            TestFrame frame = (TestFrame) manager.render(new TestFrame());

            assertEquals(List.of("C", "A", "B"), manager.getLoadOrder());
            assertEquals(List.of("B", "A", "C"), manager.getRenderOrder());
            assertEquals(List.of("B", "A", "C"), frame.getLayers());
        }

        @Test
        @DisplayName("zIndex 相同时按加载顺序")
        void tieBrokenByLoadOrder() {
            manager.register(plugin("First"), z(1));
            manager.register(plugin("Second"), z(1));
            manager.register(plugin("Back"), z(0));

            manager.start();

            assertEquals(List.of("Back", "First", "Second"), manager.getRenderOrder());
        }

        @Test
        @DisplayName("不可见插件不渲染但仍然 update")
        void invisibleStillUpdates() {
            manager.register(plugin("Hidden"), PluginConfig.builder().visible(false).build());

            manager.start();
            manager.tick(0.016);
            manager.render(new TestFrame());

            assertEquals(List.of("Hidden.update"), journalOf(".update"));
            assertTrue(journalOf(".render").isEmpty());
        }

        @Test
        @DisplayName("render 抛异常只让该插件失败，帧继续传递")
        void renderFaultIsolated() {
            manager.register(plugin("Below"), z(0));
            manager.register(plugin("Broken").failRender(), z(1));
            manager.register(plugin("Above"), z(2));

            manager.start();
            manager.tick(0.016);
            TestFrame frame = (TestFrame) manager.render(new TestFrame());

            assertEquals(List.of("Below", "Above"), frame.getLayers());
            assertEquals(FailureKind.RUNTIME_FAULT, manager.getFailure("Broken").orElseThrow().kind());
            assertEquals(List.of("Below", "Above"), manager.getRenderOrder());
        }

        @Test
        @DisplayName("render 返回 null 视为故障，保留上一帧")
        void renderNullIsFault() {
            manager.register(plugin("Null").onRender((ctx, frame) -> null), z(0));
            manager.register(plugin("Next"), z(1));

            manager.start();
            TestFrame frame = (TestFrame) manager.render(new TestFrame());

            assertEquals(List.of("Next"), frame.getLayers());
            assertEquals(PluginState.FAILED, manager.getState("Null"));
        }

        @Test
        @DisplayName("setZIndex 在下一次渲染生效")
        void zIndexChangeApplies() {
            manager.register(plugin("A"), z(0));
            manager.register(plugin("B"), z(1));
            manager.start();

            manager.setZIndex("A", 5);

            assertEquals(List.of("B", "A"), manager.getRenderOrder());
        }
    }

    // ==================== 启用 / 禁用 ====================

    @Nested
    @DisplayName("启用与禁用")
    class EnablementTests {

        @Test
        @DisplayName("禁用后下一帧不再 update/render，注册与数据保留")
        void disableKeepsRegistrationAndData() {
            manager.register(plugin("Gps").onUpdate((ctx, dt) -> ctx.provide("pos", "last-fix")));
            manager.start();
            manager.tick(0.016);

            manager.disable("Gps");
            journal.clear();
            manager.tick(0.016);
            manager.render(new TestFrame());

            assertTrue(journal.isEmpty());
            assertEquals(PluginState.DISABLED, manager.getState("Gps"));
            assertTrue(manager.isRegistered("Gps"));
            assertEquals("last-fix", manager.getDataBus().get("pos", null));
        }

        @Test
        @DisplayName("禁用在帧边界生效，而不是帧中")
        void disableTakesEffectAtBoundary() {
            manager.register(plugin("Switch").onUpdate((ctx, dt) -> manager.disable("Target")));
            manager.register(plugin("Target"));
            manager.start();

            manager.tick(0.016);
            assertEquals(1, Collections.frequency(journal, "Target.update"));

            manager.tick(0.016);
            assertEquals(1, Collections.frequency(journal, "Target.update"));
        }

        @Test
        @DisplayName("重新启用后恢复派发，不重新初始化")
        void enableResumes() {
            TestPlugin gps = plugin("Gps");
            manager.register(gps, PluginConfig.builder().enabled(false).build());
            manager.start();
            manager.tick(0.016);

            manager.enable("Gps");
            manager.tick(0.016);

            assertEquals(PluginState.ACTIVE, manager.getState("Gps"));
            assertEquals(1, Collections.frequency(journal, "Gps.update"));
            assertEquals(1, gps.getCreatedCount());
        }

        @Test
        @DisplayName("toggleVisibility 只影响渲染")
        void toggleVisibility() {
            manager.register(plugin("Hud"));
            manager.start();

            assertFalse(manager.toggleVisibility("Hud"));
            assertTrue(manager.getRenderOrder().isEmpty());
            assertEquals(PluginState.ACTIVE, manager.getState("Hud"));
        }
    }

    // ==================== 按键 ====================

    @Nested
    @DisplayName("按键派发")
    class KeyTests {

        @Test
        @DisplayName("两个插件都处理 't'，只有加载顺序靠前的收到")
        void firstConsumerWins() {
            manager.register(plugin("First").onKey((ctx, key) -> key.equals("t")));
            manager.register(plugin("Second").onKey((ctx, key) -> key.equals("t")));
            manager.start();

            assertTrue(manager.dispatchKey("t"));

            assertEquals(List.of("First.key:t"), journalOf(":t"));
        }

        @Test
        @DisplayName("无人消费时依次询问所有插件后丢弃")
        void unconsumedKey() {
            manager.register(plugin("A"));
            manager.register(plugin("B"));
            manager.start();

            assertFalse(manager.dispatchKey("q"));

            assertEquals(List.of("A.key:q", "B.key:q"), journalOf(":q"));
        }

        @Test
        @DisplayName("handleKey 抛异常的插件失败，派发继续")
        void keyFaultContinues() {
            manager.register(plugin("Broken").onKey((ctx, key) -> {
                throw new IllegalStateException("key boom");
            }));
            manager.register(plugin("Handler").onKey((ctx, key) -> true));
            manager.start();

            assertTrue(manager.dispatchKey("h"));
            assertEquals(PluginState.FAILED, manager.getState("Broken"));
        }

        @Test
        @DisplayName("禁用插件不参与按键派发")
        void disabledSkipped() {
            manager.register(plugin("Off").onKey((ctx, key) -> true), PluginConfig.builder().enabled(false).build());
            manager.start();
            manager.tick(0.016);

            assertFalse(manager.dispatchKey("x"));
        }
    }

    // ==================== 卸载与关闭 ====================

    @Nested
    @DisplayName("卸载与关闭")
    class UnloadTests {

        @Test
        @DisplayName("unregister 调用 cleanup 并使已运行的依赖方失败")
        void unregisterCascades() {
            List<String> unloaded = new ArrayList<>();
            manager.getLifecycleEventBus().subscribe(PluginUnloadedEvent.class, e -> unloaded.add(e.getPluginName()));
            TestPlugin gps = plugin("Gps");
            manager.register(gps);
            manager.register(dependent("Nav", "Gps"));
            manager.register(dependent("Hud", "Nav"));
            manager.register(plugin("Clock"));
            manager.start();

            manager.unregister("Gps");

            assertEquals(1, gps.getCleanupCount());
            assertEquals(List.of("Gps"), unloaded);
            assertFalse(manager.isRegistered("Gps"));
            assertEquals(FailureKind.MISSING_DEPENDENCY, manager.getFailure("Nav").orElseThrow().kind());
            assertEquals(FailureKind.MISSING_DEPENDENCY, manager.getFailure("Hud").orElseThrow().kind());
            assertEquals(PluginState.ACTIVE, manager.getState("Clock"));

            manager.tick(0.016);
            assertEquals(List.of("Clock"), manager.getLoadOrder());
        }

        @Test
        @DisplayName("shutdown 按加载顺序逆序 cleanup")
        void shutdownReverseOrder() {
            manager.register(dependent("Hud", "Nav"));
            manager.register(dependent("Nav", "Gps"));
            manager.register(plugin("Gps"));
            manager.start();

            manager.shutdown();

            assertEquals(List.of("Hud.cleanup", "Nav.cleanup", "Gps.cleanup"), journalOf(".cleanup"));
            assertEquals(PluginState.UNLOADED, manager.getState("Gps"));
            assertThrows(IllegalStateException.class, () -> manager.tick(0.016));
        }

        @Test
        @DisplayName("初始化失败的实例不会 cleanup")
        void failedInitNotCleanedUp() {
            TestPlugin bad = plugin("Bad").onInit(ctx -> false);
            manager.register(bad);
            manager.start();

            manager.shutdown();

            assertEquals(0, bad.getCleanupCount());
        }
    }

    // ==================== 查询 ====================

    @Nested
    @DisplayName("查询")
    class QueryTests {

        @Test
        @DisplayName("listPlugins 按注册顺序返回概览")
        void listPlugins() {
            manager.register(plugin(PluginMetadata.builder().name("Gps").version("2.1.0").author("nav-team").build()), z(3));
            manager.register(plugin("Hud"), PluginConfig.builder().visible(false).build());
            manager.start();

            List<PluginInfo> infos = manager.listPlugins();

            assertEquals(2, infos.size());
            PluginInfo gps = infos.get(0);
            assertEquals("Gps", gps.name());
            assertEquals("2.1.0", gps.version());
            assertEquals("nav-team", gps.author());
            assertEquals(3, gps.zIndex());
            assertEquals(PluginState.ACTIVE, gps.state());
            assertFalse(infos.get(1).visible());
        }

        @Test
        @DisplayName("统计信息反映当前状态")
        void stats() {
            manager.register(plugin("Ok"));
            manager.register(plugin("Bad").onInit(ctx -> false));
            manager.start();
            manager.tick(0.016);

            PluginManager.RuntimeStats stats = manager.getStats();

            assertEquals(2, stats.registered());
            assertEquals(1, stats.active());
            assertEquals(1, stats.failed());
            assertEquals(1, stats.tick());
        }
    }
}
