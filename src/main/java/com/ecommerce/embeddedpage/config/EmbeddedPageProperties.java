package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.model.PackageBinding;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 嵌入页面配置属性类
 */
@Data
@Slf4j
@Component
@ConfigurationProperties(prefix = "embedded-pages")
public class EmbeddedPageProperties implements PageConfigurationSource {

    /** 资源包绑定（有序） */
    private List<PackageConfig> packages = new ArrayList<>();

    /** 是否允许文件系统页面优先（字符串，解析失败视为 false） */
    private String allowFilesystemPages;

    /** 页面模板扩展名 */
    private String pageExtension = EmbeddedPageConstants.DEFAULT_PAGE_EXTENSION;

    /** 应用根目录，默认当前工作目录 */
    private String documentRoot;

    /** Servlet 映射 */
    private List<String> urlPatterns = new ArrayList<>(List.of(EmbeddedPageConstants.DEFAULT_URL_PATTERN));

    /** 应用就绪后立即提取 */
    private boolean eagerInit = false;

    /** 缓存根目录的父目录，默认系统临时目录 */
    private String tempDir;

    /** 缓存根目录前缀 */
    private String tempDirPrefix = EmbeddedPageConstants.DEFAULT_TEMP_DIR_PREFIX;

    /** 响应类型 */
    private String contentType = EmbeddedPageConstants.DEFAULT_CONTENT_TYPE;

    @Data
    public static class PackageConfig {
        /** 资源包标识：JAR 路径、目录或类路径上的 JAR 名 */
        private String name;
        /** 命名空间根 */
        private String namespaceRoot;
    }

    @Override
    public List<PackageBinding> packageBindings() {
        List<PackageBinding> bindings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (PackageConfig config : packages) {
            if (config == null) {
                continue;
            }
            // 同一资源包只保留第一次配置的命名空间根
            if (config.getName() != null && !seen.add(config.getName())) {
                log.warn("Duplicate embedded page package {} ignored (namespace root {})",
                    config.getName(), config.getNamespaceRoot());
                continue;
            }
            bindings.add(new PackageBinding(config.getName(), config.getNamespaceRoot()));
        }
        return bindings;
    }

    @Override
    public boolean allowFilesystemPages() {
        return parseFlag(allowFilesystemPages);
    }

    /**
     * 宽松解析布尔配置：仅 true/false（忽略大小写与首尾空白），其余一律 false
     */
    public static boolean parseFlag(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if (!"false".equals(normalized)) {
            log.warn("Unparsable boolean setting [{}], using false", value);
        }
        return false;
    }

    public Path documentRootPath() {
        return (documentRoot == null || documentRoot.isBlank())
            ? Paths.get("").toAbsolutePath()
            : Paths.get(documentRoot).toAbsolutePath().normalize();
    }

    public Path tempDirPath() {
        return (tempDir == null || tempDir.isBlank()) ? null : Paths.get(tempDir);
    }
}
