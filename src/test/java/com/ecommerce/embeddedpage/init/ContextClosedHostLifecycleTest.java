package com.ecommerce.embeddedpage.init;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 宿主生命周期测试
 */
class ContextClosedHostLifecycleTest {

    @Test
    @DisplayName("关闭时执行回调，且只执行一次")
    void testCallbacksRunOnce() {
        ContextClosedHostLifecycle lifecycle = new ContextClosedHostLifecycle();
        AtomicInteger runs = new AtomicInteger();
        lifecycle.onShutdown(runs::incrementAndGet);

        lifecycle.shutdown();
        lifecycle.shutdown();

        assertEquals(1, runs.get());
        assertEquals(0, lifecycle.pendingCallbacks());
    }

    @Test
    @DisplayName("单个回调失败不影响其他回调")
    void testFailingCallbackIsolated() {
        ContextClosedHostLifecycle lifecycle = new ContextClosedHostLifecycle();
        AtomicInteger runs = new AtomicInteger();
        lifecycle.onShutdown(() -> {
            throw new IllegalStateException("boom");
        });
        lifecycle.onShutdown(runs::incrementAndGet);

        assertDoesNotThrow(lifecycle::shutdown);
        assertEquals(1, runs.get());
    }
}
