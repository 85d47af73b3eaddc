package com.ecommerce.embeddedpage.model;

import com.ecommerce.embeddedpage.service.PathMapper;

/**
 * 资源包绑定：资源包标识 + 命名空间根
 *
 * @param packageName   资源包标识（JAR 路径、目录或类路径上的 JAR 名）
 * @param namespaceRoot 映射前需要去除的点分前缀
 */
public record PackageBinding(String packageName, String namespaceRoot) {

    /**
     * 校验后构造绑定
     */
    public static ResourceResult<PackageBinding> of(String packageName, String namespaceRoot) {
        if (packageName == null || packageName.isBlank()) {
            return ResourceResult.invalidArgument("Resource package name may not be null or empty.");
        }
        String problem = PathMapper.checkDottedName(namespaceRoot, "Base resource namespace");
        if (problem != null) {
            return ResourceResult.invalidArgument(problem + " (package [" + packageName + "])");
        }
        return ResourceResult.success(new PackageBinding(packageName.trim(), namespaceRoot));
    }
}
