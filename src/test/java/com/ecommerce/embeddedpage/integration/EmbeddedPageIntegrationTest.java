package com.ecommerce.embeddedpage.integration;

import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import com.ecommerce.embeddedpage.support.TestJars;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 嵌入页面集成测试
 * 构建临时 JAR 作为资源包，通过 HTTP 验证文件系统优先与缓存回退
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class EmbeddedPageIntegrationTest {

    private static Path workDir;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private InitializationCoordinator coordinator;

    @DynamicPropertySource
    static void embeddedPageProperties(DynamicPropertyRegistry registry) {
        try {
            workDir = Files.createTempDirectory("embedded-page-it-");
            Path jar = TestJars.builder()
                .entry("com/acme/pages/Admin/Index.jspx", "<h1>admin</h1>")
                .entry("com/acme/pages/Local.jspx", "<h1>packaged local</h1>")
                .entry("com/acme/pages/style.css", "body {}")
                .writeTo(workDir.resolve("lib/demo-pages-1.0.0.jar"));
            Path documentRoot = Files.createDirectories(workDir.resolve("www"));
            Files.writeString(documentRoot.resolve("Local.jspx"), "<h1>filesystem local</h1>");

            registry.add("embedded-pages.packages[0].name", jar::toString);
            registry.add("embedded-pages.packages[0].namespace-root", () -> "com.acme.pages");
            registry.add("embedded-pages.allow-filesystem-pages", () -> "true");
            registry.add("embedded-pages.document-root", documentRoot::toString);
            registry.add("embedded-pages.temp-dir", () -> workDir.resolve("cache").toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @AfterAll
    static void cleanUp() throws IOException {
        FileSystemUtils.deleteRecursively(workDir);
    }

    @Test
    @DisplayName("JAR 中的页面从缓存提供")
    void testServeExtractedPage() throws IOException {
        ResponseEntity<String> response = restTemplate.getForEntity("/Admin/Index.jspx", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("<h1>admin</h1>", response.getBody());
        assertTrue(coordinator.isReady());
        assertTrue(coordinator.snapshot().root().startsWith(workDir.resolve("cache").toRealPath()));
    }

    @Test
    @DisplayName("文件系统上存在同名页面时优先使用文件系统")
    void testFilesystemWins() {
        ResponseEntity<String> response = restTemplate.getForEntity("/Local.jspx", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("<h1>filesystem local</h1>", response.getBody());
    }

    @Test
    @DisplayName("两边都不存在返回 404")
    void testMissingPage() {
        ResponseEntity<String> response = restTemplate.getForEntity("/Missing.jspx", String.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    @DisplayName("并发首个请求只提取一次")
    void testConcurrentRequests() throws Exception {
        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<String>>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return restTemplate.getForEntity("/Admin/Index.jspx", String.class);
            }));
        }
        long passesBefore = coordinator.completedPasses();
        startLatch.countDown();

        for (Future<ResponseEntity<String>> future : futures) {
            ResponseEntity<String> response = future.get(30, TimeUnit.SECONDS);
            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals("<h1>admin</h1>", response.getBody());
        }
        executor.shutdown();

        assertTrue(coordinator.completedPasses() - passesBefore <= 1);
    }

    @Test
    @DisplayName("运维接口返回缓存状态")
    void testAdminStatus() {
        restTemplate.getForEntity("/Admin/Index.jspx", String.class);

        ResponseEntity<String> response = restTemplate.getForEntity("/api/embedded-pages/status", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().contains("\"state\":\"READY\""));
        assertTrue(response.getBody().contains("\"entryCount\":2"));
    }
}
