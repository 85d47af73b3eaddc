package com.ecommerce.embeddedpage.controller;

import com.ecommerce.embeddedpage.config.PageConfigurationSource;
import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import com.ecommerce.embeddedpage.model.ResolvedTarget;
import com.ecommerce.embeddedpage.render.RenderingPipeline;
import com.ecommerce.embeddedpage.service.RequestRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * 嵌入页面 Servlet
 * 请求路径 -> 应用根目录下的候选路径 -> 路由 -> 渲染管线
 */
public class EmbeddedPageServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;

    private static final Logger log = LoggerFactory.getLogger(EmbeddedPageServlet.class);

    private final transient RequestRouter router;
    private final transient PageConfigurationSource configuration;
    private final transient RenderingPipeline renderingPipeline;
    private final transient Counter filesystemCounter;
    private final transient Counter cacheCounter;

    public EmbeddedPageServlet(RequestRouter router,
                               PageConfigurationSource configuration,
                               RenderingPipeline renderingPipeline,
                               MeterRegistry meterRegistry) {
        this.router = router;
        this.configuration = configuration;
        this.renderingPipeline = renderingPipeline;
        this.filesystemCounter = Counter.builder(EmbeddedPageConstants.METRIC_REQUESTS)
            .tag("source", "filesystem")
            .description("Embedded page requests served from the filesystem")
            .register(meterRegistry);
        this.cacheCounter = Counter.builder(EmbeddedPageConstants.METRIC_REQUESTS)
            .tag("source", "cache")
            .description("Embedded page requests served from the extraction cache")
            .register(meterRegistry);
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response)
        throws ServletException, IOException {
        processRequest(request, response);
    }

    /**
     * 页面表单回发到自身
     */
    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response)
        throws ServletException, IOException {
        processRequest(request, response);
    }

    private void processRequest(HttpServletRequest request, HttpServletResponse response)
        throws ServletException, IOException {
        String virtualPath = requestPath(request);

        Path candidate = toCandidatePath(virtualPath);
        if (candidate == null) {
            log.warn("Rejected page request outside application root: {}", virtualPath);
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }

        ResolvedTarget target;
        try {
            target = router.resolve(virtualPath, candidate, configuration.allowFilesystemPages());
        } catch (ResourceCacheException e) {
            log.error("Unable to resolve page {}: {}", virtualPath, e.getMessage(), e);
            response.sendError(e.getKind().isClientError()
                ? HttpServletResponse.SC_BAD_REQUEST
                : HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            return;
        }

        (target.isFromCache() ? cacheCounter : filesystemCounter).increment();
        log.debug("Page {} resolved to {} ({})", virtualPath, target.physicalPath(), target.source());

        renderingPipeline.render(target, request, response);
    }

    static String requestPath(HttpServletRequest request) {
        String servletPath = request.getServletPath() == null ? "" : request.getServletPath();
        String pathInfo = request.getPathInfo() == null ? "" : request.getPathInfo();
        String path = servletPath + pathInfo;
        return path.startsWith("/") ? path : "/" + path;
    }

    /**
     * 虚拟路径 -> 应用根目录下的物理候选路径；越界返回 null
     */
    Path toCandidatePath(String virtualPath) {
        Path root = router.applicationRoot();
        try {
            Path candidate = root.resolve(virtualPath.substring(1)).normalize();
            return candidate.startsWith(root) ? candidate : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
