package com.ecommerce.embeddedpage.controller;

import com.ecommerce.embeddedpage.config.PageConfigurationSource;
import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.exception.ErrorKind;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import com.ecommerce.embeddedpage.model.ResolvedTarget;
import com.ecommerce.embeddedpage.render.StreamingRenderingPipeline;
import com.ecommerce.embeddedpage.service.RequestRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 页面 Servlet 测试
 */
class EmbeddedPageServletTest {

    @TempDir
    Path tempDir;

    private RequestRouter router;
    private PageConfigurationSource configuration;
    private SimpleMeterRegistry meterRegistry;
    private EmbeddedPageServlet servlet;

    @BeforeEach
    void setUp() {
        router = mock(RequestRouter.class);
        when(router.applicationRoot()).thenReturn(tempDir);
        configuration = mock(PageConfigurationSource.class);
        when(configuration.allowFilesystemPages()).thenReturn(true);
        meterRegistry = new SimpleMeterRegistry();
        servlet = new EmbeddedPageServlet(router, configuration,
            new StreamingRenderingPipeline(EmbeddedPageConstants.DEFAULT_CONTENT_TYPE), meterRegistry);
    }

    private static MockHttpServletRequest request(String method, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setServletPath(path);
        return request;
    }

    @Test
    @DisplayName("输出缓存中的页面")
    void testServeFromCache() throws Exception {
        Path cached = Files.writeString(tempDir.resolve("cached.jspx"), "<h1>cached</h1>");
        when(router.resolve(eq("/Admin/Index.jspx"), any(Path.class), eq(true)))
            .thenReturn(ResolvedTarget.serveFromCache("/Admin/Index.jspx", cached));
        MockHttpServletResponse response = new MockHttpServletResponse();

        servlet.service(request("GET", "/Admin/Index.jspx"), response);

        assertEquals(200, response.getStatus());
        assertEquals("<h1>cached</h1>", response.getContentAsString());
        assertTrue(response.getContentType().startsWith("text/html"));
        verify(router).resolve("/Admin/Index.jspx", tempDir.resolve("Admin/Index.jspx"), true);
        assertEquals(1.0, meterRegistry.get(EmbeddedPageConstants.METRIC_REQUESTS)
            .tag("source", "cache").counter().count());
    }

    @Test
    @DisplayName("表单 POST 回发到页面，与 GET 走同一路由与渲染")
    void testPostBack() throws Exception {
        Path cached = Files.writeString(tempDir.resolve("form.jspx"), "<form method=\"post\"/>");
        when(router.resolve(eq("/Form.jspx"), any(Path.class), eq(true)))
            .thenReturn(ResolvedTarget.serveFromCache("/Form.jspx", cached));
        MockHttpServletRequest request = request("POST", "/Form.jspx");
        request.setParameter("name", "value");
        MockHttpServletResponse response = new MockHttpServletResponse();

        servlet.service(request, response);

        assertEquals(200, response.getStatus());
        assertEquals("<form method=\"post\"/>", response.getContentAsString());
        verify(router).resolve("/Form.jspx", tempDir.resolve("Form.jspx"), true);
    }

    @Test
    @DisplayName("HEAD 请求只返回头")
    void testHead() throws Exception {
        Path page = Files.writeString(tempDir.resolve("Local.jspx"), "local");
        when(router.resolve(anyString(), any(Path.class), anyBoolean()))
            .thenReturn(ResolvedTarget.serveFromFilesystem("/Local.jspx", page));
        MockHttpServletResponse response = new MockHttpServletResponse();

        servlet.service(request("HEAD", "/Local.jspx"), response);

        assertEquals(200, response.getStatus());
        assertEquals(5, response.getContentLengthLong());
        assertEquals("", response.getContentAsString());
    }

    @Test
    @DisplayName("页面不存在返回 404")
    void testNotFound() throws Exception {
        when(router.resolve(anyString(), any(Path.class), anyBoolean()))
            .thenReturn(ResolvedTarget.serveFromCache("/Missing.jspx", tempDir.resolve("missing.jspx")));
        MockHttpServletResponse response = new MockHttpServletResponse();

        servlet.service(request("GET", "/Missing.jspx"), response);

        assertEquals(404, response.getStatus());
    }

    @Test
    @DisplayName("越出应用根目录的请求返回 404，不进入路由")
    void testEscapingRequest() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        servlet.service(request("GET", "/../../etc/passwd.jspx"), response);

        assertEquals(404, response.getStatus());
        verify(router, never()).resolve(anyString(), any(Path.class), anyBoolean());
    }

    @Test
    @DisplayName("初始化失败返回 500，参数错误返回 400")
    void testRouterFailures() throws Exception {
        when(router.resolve(eq("/Broken.jspx"), any(Path.class), anyBoolean()))
            .thenThrow(ResourceCacheException.packageLoadFailure("pages", null));
        when(router.resolve(eq("/Invalid.jspx"), any(Path.class), anyBoolean()))
            .thenThrow(new ResourceCacheException(ErrorKind.INVALID_ARGUMENT, "bad path"));

        MockHttpServletResponse broken = new MockHttpServletResponse();
        servlet.service(request("GET", "/Broken.jspx"), broken);
        MockHttpServletResponse invalid = new MockHttpServletResponse();
        servlet.service(request("GET", "/Invalid.jspx"), invalid);

        assertEquals(500, broken.getStatus());
        assertEquals(400, invalid.getStatus());
    }

    @Test
    @DisplayName("请求路径由 servletPath 与 pathInfo 拼接")
    void testRequestPath() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setServletPath("/pages");
        request.setPathInfo("/Admin/Index.jspx");

        assertEquals("/pages/Admin/Index.jspx", EmbeddedPageServlet.requestPath(request));
    }
}
