package com.ecommerce.embeddedpage.loader;

/**
 * 资源包加载器
 */
@FunctionalInterface
public interface PackageLoader {

    /**
     * 按标识加载资源包
     * @throws com.ecommerce.embeddedpage.exception.ResourceCacheException 加载失败（PACKAGE_LOAD_FAILURE）
     */
    ResourcePackage load(String packageName);
}
