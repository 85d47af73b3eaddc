package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.loader.ResourcePackage;
import com.ecommerce.embeddedpage.model.ResourceResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 资源目录：判断哪些资源是可提供的页面模板
 * 规则：标识长度大于扩展名长度，且以扩展名结尾（忽略大小写）
 */
public class ResourceCatalog {

    private final String pageExtension;

    public ResourceCatalog() {
        this(EmbeddedPageConstants.DEFAULT_PAGE_EXTENSION);
    }

    public ResourceCatalog(String pageExtension) {
        if (pageExtension == null || pageExtension.length() < 2 || pageExtension.charAt(0) != '.') {
            throw new IllegalArgumentException("Page extension must be a period followed by at least one character: "
                + pageExtension);
        }
        this.pageExtension = pageExtension;
    }

    public String pageExtension() {
        return pageExtension;
    }

    /**
     * 是否为页面资源；null、过短或扩展名不匹配均返回 false
     */
    public boolean isEligible(String resourceName) {
        // 至少一个字符的文件名 + 扩展名
        if (resourceName == null || resourceName.length() <= pageExtension.length()) {
            return false;
        }
        return resourceName.regionMatches(true, resourceName.length() - pageExtension.length(),
            pageExtension, 0, pageExtension.length());
    }

    /**
     * 列出资源包中的页面资源，保持资源包的枚举顺序
     * 返回独立的列表，修改它不影响资源包
     */
    public ResourceResult<List<String>> listEligible(ResourcePackage resourcePackage) {
        if (resourcePackage == null) {
            return ResourceResult.invalidArgument("Resource package to enumerate pages in may not be null.");
        }
        List<String> pages = new ArrayList<>();
        for (String resourceName : resourcePackage.resourceNames()) {
            if (isEligible(resourceName)) {
                pages.add(resourceName);
            }
        }
        return ResourceResult.success(pages);
    }
}
