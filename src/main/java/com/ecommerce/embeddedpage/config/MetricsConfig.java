package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.model.CacheSnapshot;
import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import com.ecommerce.embeddedpage.service.InitializationListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 嵌入页面监控指标
 * 1. 已提取页面数、就绪状态（Gauge）
 * 2. 提取耗时（Timer）
 * 3. 提取失败次数（Counter）
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry meterRegistry;
    private final InitializationCoordinator coordinator;

    public MetricsConfig(MeterRegistry meterRegistry, InitializationCoordinator coordinator) {
        this.meterRegistry = meterRegistry;
        this.coordinator = coordinator;
    }

    @PostConstruct
    public void initMetrics() {
        Gauge.builder(EmbeddedPageConstants.METRIC_ENTRIES, coordinator, c -> c.snapshot().size())
            .description("Pages currently extracted into the cache root")
            .register(meterRegistry);

        Gauge.builder(EmbeddedPageConstants.METRIC_READY, coordinator, c -> c.isReady() ? 1 : 0)
            .description("1 when the extraction cache is ready")
            .register(meterRegistry);

        Timer initializationTimer = Timer.builder(EmbeddedPageConstants.METRIC_INITIALIZATION)
            .description("Duration of the extraction pass")
            .tag("outcome", "success")
            .register(meterRegistry);
        Timer failureTimer = Timer.builder(EmbeddedPageConstants.METRIC_INITIALIZATION)
            .description("Duration of the extraction pass")
            .tag("outcome", "failure")
            .register(meterRegistry);
        Counter teardownCounter = Counter.builder("embedded.pages.teardown")
            .description("Cache teardowns")
            .register(meterRegistry);

        coordinator.addListener(new InitializationListener() {
            @Override
            public void onInitialized(CacheSnapshot snapshot, Duration duration) {
                initializationTimer.record(duration);
            }

            @Override
            public void onInitializationFailure(Throwable cause, Duration duration) {
                failureTimer.record(duration);
            }

            @Override
            public void onTeardown() {
                teardownCounter.increment();
            }
        });

        log.info("Embedded page metrics initialized");
    }
}
