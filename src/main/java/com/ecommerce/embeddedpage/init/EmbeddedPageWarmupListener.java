package com.ecommerce.embeddedpage.init;

import com.ecommerce.embeddedpage.config.EmbeddedPageProperties;
import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 嵌入页面预热监听器
 * 开启 embedded-pages.eager-init 时，应用启动完成后立即提取，失败则留给首个请求重试
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddedPageWarmupListener {

    private final EmbeddedPageProperties properties;
    private final InitializationCoordinator coordinator;
    private final HostLifecycle hostLifecycle;

    @EventListener(ApplicationReadyEvent.class)
    public void warmup() {
        if (!properties.isEagerInit()) {
            log.debug("Eager extraction disabled, pages are extracted on first request");
            return;
        }
        log.info(">>> Starting embedded page warmup...");
        try {
            coordinator.ensureInitialized(hostLifecycle);
        } catch (RuntimeException e) {
            log.error(">>> Embedded page warmup failed, first request will retry", e);
        }
    }
}
