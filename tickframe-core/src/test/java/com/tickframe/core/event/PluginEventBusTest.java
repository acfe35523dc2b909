package com.tickframe.core.event;

import com.tickframe.api.event.PluginEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginEventBus 单元测试")
class PluginEventBusTest {

    @Nested
    @DisplayName("投递与取出")
    class PostDrainTests {

        @Test
        @DisplayName("drain 按投递顺序返回并清空队列")
        void drainReturnsInOrder() {
            PluginEventBus bus = new PluginEventBus();
            bus.post(PluginEvent.of("first", 1));
            bus.post(PluginEvent.of("second", 2));

            List<PluginEvent> events = bus.drain();

            assertEquals(List.of("first", "second"), events.stream().map(PluginEvent::getType).toList());
            assertEquals(0, bus.getPendingCount());
            assertTrue(bus.drain().isEmpty());
        }

        @Test
        @DisplayName("drain 之后投递的事件留到下一次")
        void postAfterDrainWaits() {
            PluginEventBus bus = new PluginEventBus();
            bus.post(PluginEvent.of("a", null));
            List<PluginEvent> batch = bus.drain();
            bus.post(PluginEvent.of("b", null));

            assertEquals(1, batch.size());
            assertEquals(1, bus.getPendingCount());
        }

        @Test
        @DisplayName("null 事件被拒绝")
        void nullRejected() {
            PluginEventBus bus = new PluginEventBus();
            assertThrows(IllegalArgumentException.class, () -> bus.post(null));
        }
    }

    @Nested
    @DisplayName("容量")
    class CapacityTests {

        @Test
        @DisplayName("默认容量 1000")
        void defaultCapacity() {
            assertEquals(1000, new PluginEventBus().getCapacity());
        }

        @Test
        @DisplayName("队列满时丢弃最旧事件")
        void dropsOldest() {
            PluginEventBus bus = new PluginEventBus(3);
            for (int i = 0; i < 5; i++) {
                bus.post(PluginEvent.of("e" + i, i));
            }

            List<PluginEvent> events = bus.drain();
            assertEquals(List.of("e2", "e3", "e4"), events.stream().map(PluginEvent::getType).toList());
            assertEquals(2, bus.getDroppedCount());
        }

        @Test
        @DisplayName("非正容量非法")
        void invalidCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new PluginEventBus(0));
        }
    }
}
