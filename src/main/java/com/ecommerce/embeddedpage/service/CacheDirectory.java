package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * 缓存根目录生命周期：重建、定位、递归删除
 * 同一时刻只有一个根目录处于活动状态，重建前先删除旧目录
 *
 * 非线程安全，由 {@link InitializationCoordinator} 在互斥区内调用
 */
@Slf4j
public class CacheDirectory {

    private final Path tempBase;
    private final String prefix;

    private volatile Path root;

    public CacheDirectory() {
        this(null, EmbeddedPageConstants.DEFAULT_TEMP_DIR_PREFIX);
    }

    /**
     * @param tempBase 临时目录的父目录，null 使用系统临时目录
     * @param prefix   目录名前缀
     */
    public CacheDirectory(Path tempBase, String prefix) {
        this.tempBase = tempBase;
        this.prefix = (prefix == null || prefix.isEmpty()) ? EmbeddedPageConstants.DEFAULT_TEMP_DIR_PREFIX : prefix;
    }

    /** 当前活动根目录，没有时为 null */
    public Path root() {
        return root;
    }

    public boolean isActive() {
        return root != null;
    }

    /**
     * 删除现有根目录并创建新的唯一根目录
     * @return 新根目录的规范绝对路径
     */
    public Path recreate() {
        destroy();

        Path created;
        try {
            created = createTempDirectory();
        } catch (IOException | RuntimeException e) {
            throw ResourceCacheException.directoryFailure(
                "Unable to create cache root under [" + describeBase() + "]", e);
        }

        if (!Files.isWritable(created)) {
            throw ResourceCacheException.directoryFailure(
                "Cache root [" + created + "] is not writable", null);
        }

        try {
            root = created.toRealPath();
        } catch (IOException e) {
            throw ResourceCacheException.directoryFailure(
                "Unable to canonicalize cache root [" + created + "]", e);
        }
        log.info("Created cache root {}", root);
        return root;
    }

    private Path createTempDirectory() throws IOException {
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        if (tempBase == null) {
            return posix
                ? Files.createTempDirectory(prefix, PosixFilePermissions.asFileAttribute(
                    PosixFilePermissions.fromString(EmbeddedPageConstants.CACHE_DIR_PERMISSIONS)))
                : Files.createTempDirectory(prefix);
        }
        Files.createDirectories(tempBase);
        return posix
            ? Files.createTempDirectory(tempBase, prefix, PosixFilePermissions.asFileAttribute(
                PosixFilePermissions.fromString(EmbeddedPageConstants.CACHE_DIR_PERMISSIONS)))
            : Files.createTempDirectory(tempBase, prefix);
    }

    private String describeBase() {
        return tempBase == null ? System.getProperty("java.io.tmpdir") : tempBase.toString();
    }

    /**
     * 根目录下的路径；结果必须仍位于根目录内
     */
    public Path pathUnder(Path base, String relative) {
        if (base == null) {
            throw ResourceCacheException.invalidArgument("Cache root may not be null.");
        }
        if (relative == null) {
            throw ResourceCacheException.invalidArgument("Relative cache path may not be null.");
        }
        String trimmed = relative.replace('\\', '/');
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        Path normalizedBase = base.toAbsolutePath().normalize();
        Path resolved = normalizedBase.resolve(trimmed).normalize();
        if (!resolved.startsWith(normalizedBase)) {
            throw ResourceCacheException.invalidArgument(
                "Path [" + relative + "] escapes cache root [" + base + "]");
        }
        return resolved;
    }

    /**
     * 递归删除当前根目录；已不存在视为成功，没有活动目录时什么都不做
     */
    public void destroy() {
        Path current = root;
        if (current == null) {
            return;
        }
        try {
            deleteRecursively(current);
        } catch (IOException e) {
            throw ResourceCacheException.directoryFailure("Unable to delete cache root [" + current + "]", e);
        }
        root = null;
        log.info("Deleted cache root {}", current);
    }

    static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null && !(exc instanceof NoSuchFileException)) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
