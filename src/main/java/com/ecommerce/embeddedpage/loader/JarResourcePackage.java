package com.ecommerce.embeddedpage.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 基于 JAR 文件的资源包
 * 只读取指定 JAR，不经过类加载器委派
 */
public final class JarResourcePackage implements ResourcePackage {

    private static final Logger log = LoggerFactory.getLogger(JarResourcePackage.class);

    private final String name;
    private final Path jarPath;
    private final JarFile jarFile;
    // 资源标识 -> JAR 条目名，保持 JAR 中的条目顺序
    private final Map<String, String> entries;

    public JarResourcePackage(String name, Path jarPath) throws IOException {
        this(name, jarPath, new JarFile(jarPath.toFile()));
    }

    /**
     * 接管已打开的 JarFile；建立索引失败时关闭它
     */
    JarResourcePackage(String name, Path jarPath, JarFile jarFile) {
        this.name = name;
        this.jarPath = jarPath;
        this.jarFile = jarFile;
        try {
            this.entries = indexEntries(jarFile);
        } catch (RuntimeException e) {
            try {
                jarFile.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private static Map<String, String> indexEntries(JarFile jarFile) {
        Map<String, String> result = new LinkedHashMap<>();
        Enumeration<JarEntry> jarEntries = jarFile.entries();
        while (jarEntries.hasMoreElements()) {
            JarEntry entry = jarEntries.nextElement();
            if (entry.isDirectory()) {
                continue;
            }
            String resourceName = ResourcePackage.toResourceName(entry.getName());
            // 不同目录结构可能得到相同的点分标识，先出现者优先
            if (result.putIfAbsent(resourceName, entry.getName()) != null) {
                log.debug("Ignoring entry {} in {}, resource name {} already taken",
                    entry.getName(), jarFile.getName(), resourceName);
            }
        }
        return result;
    }

    @Override
    public String name() {
        return name;
    }

    public Path jarPath() {
        return jarPath;
    }

    @Override
    public List<String> resourceNames() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    @Override
    public InputStream open(String resourceName) throws IOException {
        String entryName = entries.get(resourceName);
        if (entryName == null) {
            return null;
        }
        JarEntry entry = jarFile.getJarEntry(entryName);
        return entry == null ? null : jarFile.getInputStream(entry);
    }

    @Override
    public void close() {
        try {
            jarFile.close();
        } catch (IOException e) {
            log.warn("Failed to close resource package {} ({})", name, jarPath, e);
        }
    }

    @Override
    public String toString() {
        return "JarResourcePackage[" + name + " -> " + jarPath + "]";
    }
}
