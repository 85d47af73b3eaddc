package com.ecommerce.embeddedpage.health;

import com.ecommerce.embeddedpage.model.CacheSnapshot;
import com.ecommerce.embeddedpage.model.InitializationState;
import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * 嵌入页面缓存健康检查
 * READY 且根目录存在：UP；未初始化：UNKNOWN；根目录丢失：DOWN
 */
@Component("embeddedPageHealthIndicator")
@RequiredArgsConstructor
public class EmbeddedPageHealthIndicator implements HealthIndicator {

    private final InitializationCoordinator coordinator;

    @Override
    public Health health() {
        InitializationState state = coordinator.state();
        CacheSnapshot snapshot = coordinator.snapshot();

        Map<String, Object> details = new HashMap<>();
        details.put("state", state.name());
        details.put("entries", snapshot.size());
        if (snapshot.root() != null) {
            details.put("cacheRoot", snapshot.root().toString());
        }

        if (state != InitializationState.READY) {
            return Health.unknown().withDetails(details).build();
        }
        if (snapshot.root() == null || !Files.isDirectory(snapshot.root())) {
            details.put("error", "cache root missing");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
