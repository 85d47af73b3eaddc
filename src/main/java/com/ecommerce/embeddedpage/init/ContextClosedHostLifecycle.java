package com.ecommerce.embeddedpage.init;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring 容器关闭时执行已注册的回调
 * 每个回调最多执行一次，回调异常只记录日志
 */
@Slf4j
public class ContextClosedHostLifecycle implements HostLifecycle, ApplicationListener<ContextClosedEvent> {

    private final List<Runnable> callbacks = new ArrayList<>();

    @Override
    public synchronized void onShutdown(Runnable callback) {
        callbacks.add(callback);
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * 执行并清空所有回调
     */
    public void shutdown() {
        List<Runnable> pending;
        synchronized (this) {
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        if (!pending.isEmpty()) {
            log.info("Running {} shutdown callbacks", pending.size());
        }
        for (Runnable callback : pending) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Shutdown callback failed", e);
            }
        }
    }

    public synchronized int pendingCallbacks() {
        return callbacks.size();
    }
}
