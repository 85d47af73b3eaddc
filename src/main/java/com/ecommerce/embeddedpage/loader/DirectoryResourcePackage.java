package com.ecommerce.embeddedpage.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 基于已展开类目录的资源包（如 target/classes）
 * 枚举顺序为相对路径的字典序
 */
public final class DirectoryResourcePackage implements ResourcePackage {

    private final String name;
    private final Path directory;
    private final Map<String, Path> entries;

    public DirectoryResourcePackage(String name, Path directory) throws IOException {
        this.name = name;
        this.directory = directory.toAbsolutePath().normalize();
        this.entries = indexEntries(this.directory);
    }

    private static Map<String, Path> indexEntries(Path directory) throws IOException {
        Map<String, Path> result = new LinkedHashMap<>();
        try (Stream<Path> files = Files.walk(directory)) {
            files.filter(Files::isRegularFile)
                .sorted()
                .forEach(file -> result.putIfAbsent(
                    ResourcePackage.toResourceName(directory.relativize(file).toString()), file));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return result;
    }

    @Override
    public String name() {
        return name;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public List<String> resourceNames() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    @Override
    public InputStream open(String resourceName) throws IOException {
        Path file = entries.get(resourceName);
        if (file == null || !Files.isRegularFile(file)) {
            return null;
        }
        return Files.newInputStream(file);
    }

    @Override
    public void close() {
        // 目录不持有句柄
    }

    @Override
    public String toString() {
        return "DirectoryResourcePackage[" + name + " -> " + directory + "]";
    }
}
