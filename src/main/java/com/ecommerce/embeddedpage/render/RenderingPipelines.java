package com.ecommerce.embeddedpage.render;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;

/**
 * 渲染管线能力查找，启动时执行一次
 * 宿主提供唯一的 {@link RenderingPipeline} Bean 时使用宿主入口，否则使用内置流式管线
 */
@Slf4j
public final class RenderingPipelines {

    private RenderingPipelines() {}

    public static RenderingPipeline resolve(ObjectProvider<RenderingPipeline> hostPipelines, String contentType) {
        RenderingPipeline hostPipeline = hostPipelines == null ? null : hostPipelines.getIfUnique();
        if (hostPipeline != null) {
            log.info("Using host rendering pipeline {}", hostPipeline.getClass().getName());
            return hostPipeline;
        }
        log.info("Using built-in streaming rendering pipeline ({})", contentType);
        return new StreamingRenderingPipeline(contentType);
    }
}
