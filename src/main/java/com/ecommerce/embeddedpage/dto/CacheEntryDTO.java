package com.ecommerce.embeddedpage.dto;

import com.ecommerce.embeddedpage.model.ExtractedEntry;

/**
 * 缓存条目
 */
public record CacheEntryDTO(String virtualPath, String absolutePath, String packageName, String resourceName) {

    public static CacheEntryDTO from(ExtractedEntry entry) {
        return new CacheEntryDTO(entry.virtualPath(), entry.absolutePath().toString(),
            entry.packageName(), entry.resourceName());
    }
}
