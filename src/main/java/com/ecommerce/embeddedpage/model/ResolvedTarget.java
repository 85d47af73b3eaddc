package com.ecommerce.embeddedpage.model;

import java.nio.file.Path;

/**
 * 请求解析结果：从真实文件系统或从提取缓存提供页面
 *
 * @param source        来源
 * @param requestedPath 原始请求的虚拟路径
 * @param physicalPath  解析后的物理路径
 */
public record ResolvedTarget(Source source, String requestedPath, Path physicalPath) {

    public enum Source {
        FILESYSTEM,
        CACHE
    }

    public static ResolvedTarget serveFromFilesystem(String requestedPath, Path physicalPath) {
        return new ResolvedTarget(Source.FILESYSTEM, requestedPath, physicalPath);
    }

    public static ResolvedTarget serveFromCache(String requestedPath, Path mappedPath) {
        return new ResolvedTarget(Source.CACHE, requestedPath, mappedPath);
    }

    public boolean isFromCache() {
        return source == Source.CACHE;
    }
}
