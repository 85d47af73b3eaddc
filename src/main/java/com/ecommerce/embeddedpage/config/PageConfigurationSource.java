package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.model.PackageBinding;

import java.util.List;

/**
 * 嵌入页面配置来源
 * 未配置时分别视为空列表 / false，不视为错误
 */
public interface PageConfigurationSource {

    /**
     * 有序的资源包绑定
     */
    List<PackageBinding> packageBindings();

    /**
     * 是否允许优先使用真实文件系统上的页面
     */
    boolean allowFilesystemPages();
}
