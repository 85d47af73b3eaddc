package com.ecommerce.embeddedpage.loader;

import com.ecommerce.embeddedpage.exception.ResourceCacheException;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 默认资源包加载器
 * 解析顺序：
 * 1. 标识本身是存在的 JAR 文件或目录路径
 * 2. 类路径中第一个文件名等于标识、标识 + ".jar" 或 "标识-版本.jar" 的条目
 */
@Slf4j
public class ClasspathPackageLoader implements PackageLoader {

    private static final String JAR_SUFFIX = ".jar";

    private final List<Path> searchPath;

    public ClasspathPackageLoader() {
        this(systemClassPath());
    }

    public ClasspathPackageLoader(List<Path> searchPath) {
        this.searchPath = List.copyOf(searchPath);
    }

    static List<Path> systemClassPath() {
        String classPath = System.getProperty("java.class.path", "");
        if (classPath.isEmpty()) {
            return Collections.emptyList();
        }
        List<Path> paths = new ArrayList<>();
        for (String element : classPath.split(File.pathSeparator)) {
            if (element.isBlank()) {
                continue;
            }
            try {
                paths.add(Paths.get(element));
            } catch (InvalidPathException e) {
                log.debug("Skipping unparsable class path element {}", element);
            }
        }
        return paths;
    }

    public List<Path> searchPath() {
        return searchPath;
    }

    @Override
    public ResourcePackage load(String packageName) {
        if (packageName == null || packageName.isBlank()) {
            throw ResourceCacheException.invalidArgument("Resource package name may not be null or empty.");
        }

        Path location = locate(packageName);
        if (location == null) {
            throw ResourceCacheException.packageLoadFailure(packageName,
                new IOException("No JAR or directory found for [" + packageName + "]"));
        }

        try {
            ResourcePackage resourcePackage = Files.isDirectory(location)
                ? new DirectoryResourcePackage(packageName, location)
                : new JarResourcePackage(packageName, location);
            log.debug("Loaded resource package {} from {}", packageName, location);
            return resourcePackage;
        } catch (IOException | RuntimeException e) {
            throw ResourceCacheException.packageLoadFailure(packageName, e);
        }
    }

    /**
     * 定位资源包，找不到返回 null
     */
    Path locate(String packageName) {
        try {
            Path direct = Paths.get(packageName);
            if (Files.isRegularFile(direct) || Files.isDirectory(direct)) {
                return direct;
            }
        } catch (InvalidPathException e) {
            log.debug("Package name {} is not a filesystem path", packageName);
        }

        for (Path element : searchPath) {
            Path fileName = element.getFileName();
            if (fileName == null || !Files.exists(element)) {
                continue;
            }
            if (matches(fileName.toString(), packageName)) {
                return element;
            }
        }
        return null;
    }

    static boolean matches(String fileName, String packageName) {
        if (fileName.equals(packageName) || fileName.equals(packageName + JAR_SUFFIX)) {
            return true;
        }
        // artifact-1.2.3.jar
        return fileName.startsWith(packageName + "-")
            && fileName.endsWith(JAR_SUFFIX)
            && fileName.length() > packageName.length() + 1 + JAR_SUFFIX.length()
            && Character.isDigit(fileName.charAt(packageName.length() + 1));
    }
}
