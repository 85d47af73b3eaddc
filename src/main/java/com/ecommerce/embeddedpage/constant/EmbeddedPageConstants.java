package com.ecommerce.embeddedpage.constant;

/**
 * 嵌入页面相关常量
 */
public final class EmbeddedPageConstants {

    private EmbeddedPageConstants() {}

    // ==================== 资源 ====================

    /** 默认页面模板扩展名（JSP 文档） */
    public static final String DEFAULT_PAGE_EXTENSION = ".jspx";

    /** 资源复制缓冲区大小（字节） */
    public static final int COPY_BUFFER_SIZE = 1024;

    // ==================== 缓存目录 ====================

    /** 临时缓存根目录前缀 */
    public static final String DEFAULT_TEMP_DIR_PREFIX = "embedded-pages-";

    /** 缓存根目录权限（仅所有者可读写执行） */
    public static final String CACHE_DIR_PERMISSIONS = "rwx------";

    // ==================== Web ====================

    /** 默认 Servlet 映射 */
    public static final String DEFAULT_URL_PATTERN = "*.jspx";

    /** 默认响应类型 */
    public static final String DEFAULT_CONTENT_TYPE = "text/html;charset=UTF-8";

    /** Servlet 注册名 */
    public static final String SERVLET_NAME = "embeddedPageServlet";

    // ==================== 监控指标 ====================

    public static final String METRIC_ENTRIES = "embedded.pages.entries";

    public static final String METRIC_READY = "embedded.pages.ready";

    public static final String METRIC_INITIALIZATION = "embedded.pages.initialization";

    public static final String METRIC_REQUESTS = "embedded.pages.requests";
}
