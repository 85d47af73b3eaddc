package com.ecommerce.embeddedpage.controller;

import com.ecommerce.embeddedpage.config.EmbeddedPageProperties;
import com.ecommerce.embeddedpage.dto.ApiResponse;
import com.ecommerce.embeddedpage.dto.CacheEntryDTO;
import com.ecommerce.embeddedpage.dto.CacheStatusDTO;
import com.ecommerce.embeddedpage.init.HostLifecycle;
import com.ecommerce.embeddedpage.model.CacheSnapshot;
import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 嵌入页面缓存运维 API
 */
@Slf4j
@RestController
@RequestMapping("/api/embedded-pages")
@RequiredArgsConstructor
@Tag(name = "Embedded pages", description = "提取缓存状态与重建")
public class EmbeddedPageAdminController {

    private final InitializationCoordinator coordinator;
    private final EmbeddedPageProperties properties;
    private final HostLifecycle hostLifecycle;

    /**
     * 缓存状态
     */
    @GetMapping("/status")
    @Operation(summary = "缓存状态")
    public ApiResponse<CacheStatusDTO> status() {
        return ApiResponse.success(currentStatus());
    }

    /**
     * 已提取页面列表
     */
    @GetMapping("/entries")
    @Operation(summary = "已提取页面列表")
    public ApiResponse<List<CacheEntryDTO>> entries() {
        List<CacheEntryDTO> entries = coordinator.snapshot().entries().stream()
            .map(CacheEntryDTO::from)
            .toList();
        return ApiResponse.success(entries);
    }

    /**
     * 删除缓存并重新提取
     */
    @PostMapping("/reload")
    @Operation(summary = "删除缓存并重新提取")
    public ApiResponse<CacheStatusDTO> reload() {
        log.info("Manual embedded page reload requested");
        coordinator.teardown();
        coordinator.ensureInitialized(hostLifecycle);
        return ApiResponse.success(currentStatus());
    }

    /**
     * 删除缓存，下一个请求重新提取
     */
    @DeleteMapping("/cache")
    @Operation(summary = "删除缓存")
    public ApiResponse<CacheStatusDTO> teardown() {
        log.info("Manual embedded page teardown requested");
        coordinator.teardown();
        return ApiResponse.success(currentStatus());
    }

    private CacheStatusDTO currentStatus() {
        CacheSnapshot snapshot = coordinator.snapshot();
        return CacheStatusDTO.builder()
            .state(coordinator.state().name())
            .cacheRoot(snapshot.root() == null ? null : snapshot.root().toString())
            .entryCount(snapshot.size())
            .completedPasses(coordinator.completedPasses())
            .allowFilesystemPages(properties.allowFilesystemPages())
            .build();
    }
}
