package com.ecommerce.embeddedpage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatusDTO {

    /** 初始化状态 */
    private String state;

    /** 缓存根目录 */
    private String cacheRoot;

    /** 已提取页面数 */
    private int entryCount;

    /** 已成功完成的提取次数 */
    private long completedPasses;

    /** 是否允许文件系统页面优先 */
    private boolean allowFilesystemPages;
}
