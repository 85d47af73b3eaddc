package com.ecommerce.embeddedpage.render;

import com.ecommerce.embeddedpage.model.ResolvedTarget;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 内置渲染管线：原样输出文件字节，不解析内容
 */
@Slf4j
public class StreamingRenderingPipeline implements RenderingPipeline {

    private final String contentType;

    public StreamingRenderingPipeline(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    @Override
    public void render(ResolvedTarget target, HttpServletRequest request, HttpServletResponse response)
        throws IOException {
        Path file = target.physicalPath();
        if (file == null || !Files.isRegularFile(file)) {
            log.debug("Page {} not found at {} ({})", target.requestedPath(), file, target.source());
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }

        response.setContentType(contentType);
        response.setContentLengthLong(Files.size(file));
        if ("HEAD".equalsIgnoreCase(request.getMethod())) {
            return;
        }
        Files.copy(file, response.getOutputStream());
    }
}
