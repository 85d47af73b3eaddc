package com.ecommerce.embeddedpage.model;

import java.nio.file.Path;

/**
 * 已提取条目：虚拟路径 -> 缓存目录中的绝对路径
 *
 * @param virtualPath  相对缓存根目录的虚拟路径（以 / 分隔，/ 开头）
 * @param absolutePath 提取后的绝对路径
 * @param packageName  来源资源包
 * @param resourceName 来源资源标识
 */
public record ExtractedEntry(
    String virtualPath,
    Path absolutePath,
    String packageName,
    String resourceName
) {}
