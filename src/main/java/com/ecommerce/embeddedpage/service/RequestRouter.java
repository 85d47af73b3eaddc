package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.exception.ErrorKind;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import com.ecommerce.embeddedpage.init.HostLifecycle;
import com.ecommerce.embeddedpage.model.CacheSnapshot;
import com.ecommerce.embeddedpage.model.ResolvedTarget;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 请求路由：决定从真实文件系统还是从提取缓存提供页面
 *
 * - 允许文件系统页面且文件真实存在：FILESYSTEM
 * - 否则把候选路径中的应用根目录前缀替换为缓存根目录：CACHE（不检查文件是否存在）
 *
 * 初始化异常不在此处捕获，直接交给宿主
 */
public class RequestRouter {

    private final InitializationCoordinator coordinator;
    private final HostLifecycle hostLifecycle;
    private final Path applicationRoot;

    public RequestRouter(InitializationCoordinator coordinator, HostLifecycle hostLifecycle, Path applicationRoot) {
        this.coordinator = coordinator;
        this.hostLifecycle = hostLifecycle;
        this.applicationRoot = (applicationRoot == null ? Paths.get("") : applicationRoot)
            .toAbsolutePath().normalize();
    }

    public Path applicationRoot() {
        return applicationRoot;
    }

    /**
     * 解析请求
     * @param requestedVirtualPath   请求的虚拟路径（透传给渲染管线）
     * @param physicalCandidatePath  宿主给出的物理候选路径
     * @param allowFilesystemFallback 是否允许使用真实文件系统上的页面
     */
    public ResolvedTarget resolve(String requestedVirtualPath, String physicalCandidatePath,
                                  boolean allowFilesystemFallback) {
        if (physicalCandidatePath == null) {
            throw ResourceCacheException.invalidArgument("Path to map may not be null.");
        }
        if (physicalCandidatePath.isEmpty()) {
            throw ResourceCacheException.invalidArgument("Path to map may not be empty.");
        }
        Path candidate;
        try {
            candidate = Paths.get(physicalCandidatePath);
        } catch (InvalidPathException e) {
            throw new ResourceCacheException(ErrorKind.INVALID_ARGUMENT,
                "Path to map is not a valid path: " + physicalCandidatePath, e);
        }
        return resolve(requestedVirtualPath, candidate, allowFilesystemFallback);
    }

    public ResolvedTarget resolve(String requestedVirtualPath, Path physicalCandidatePath,
                                  boolean allowFilesystemFallback) {
        if (physicalCandidatePath == null || physicalCandidatePath.toString().isEmpty()) {
            throw ResourceCacheException.invalidArgument("Path to map may not be null or empty.");
        }

        // 整个请求使用同一个快照
        CacheSnapshot current = coordinator.ensureInitialized(hostLifecycle);

        if (allowFilesystemFallback && Files.isRegularFile(physicalCandidatePath)) {
            return ResolvedTarget.serveFromFilesystem(requestedVirtualPath, physicalCandidatePath);
        }
        return ResolvedTarget.serveFromCache(requestedVirtualPath, toCachePath(physicalCandidatePath, current));
    }

    /**
     * 物理路径 -> 缓存路径
     * 不在应用根目录下的路径原样（规范化后）返回
     */
    Path toCachePath(Path physicalCandidatePath, CacheSnapshot current) {
        Path full = physicalCandidatePath.toAbsolutePath().normalize();
        String fullPath = full.toString();
        String rootPath = applicationRoot.toString();

        if (!isUnderRoot(fullPath, rootPath, full.getFileSystem().getSeparator())) {
            return full;
        }
        return coordinator.resolveInCache(current, fullPath.substring(rootPath.length()));
    }

    static boolean isUnderRoot(String fullPath, String rootPath, String separator) {
        if (!fullPath.regionMatches(true, 0, rootPath, 0, rootPath.length())) {
            return false;
        }
        // 必须在路径段边界上：/app 不匹配 /application
        return fullPath.length() == rootPath.length()
            || rootPath.endsWith(separator)
            || fullPath.startsWith(separator, rootPath.length());
    }
}
