package com.ecommerce.embeddedpage.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 一次初始化产出的不可变快照：缓存根目录 + 缓存索引
 * 索引键为小写虚拟路径，构建完成后整体发布，读者不会看到半成品
 */
public final class CacheSnapshot {

    public static final CacheSnapshot EMPTY = new CacheSnapshot(null, Collections.emptyMap());

    private final Path root;
    private final Map<String, ExtractedEntry> index;

    private CacheSnapshot(Path root, Map<String, ExtractedEntry> index) {
        this.root = root;
        this.index = index;
    }

    public static CacheSnapshot of(Path root, Map<String, ExtractedEntry> index) {
        return new CacheSnapshot(root, Collections.unmodifiableMap(new LinkedHashMap<>(index)));
    }

    /**
     * 索引键：虚拟路径按 Locale.ROOT 转小写
     */
    public static String indexKey(String virtualPath) {
        return virtualPath.toLowerCase(Locale.ROOT);
    }

    /** 缓存根目录，未初始化时为 null */
    public Path root() {
        return root;
    }

    public Map<String, ExtractedEntry> index() {
        return index;
    }

    public Collection<ExtractedEntry> entries() {
        return index.values();
    }

    public int size() {
        return index.size();
    }

    public Optional<ExtractedEntry> lookup(String virtualPath) {
        if (virtualPath == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(indexKey(virtualPath)));
    }
}
