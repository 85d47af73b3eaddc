package com.ecommerce.embeddedpage.exception;

/**
 * 资源缓存错误类型
 */
public enum ErrorKind {

    /** 参数为空、为 null 或格式非法 */
    INVALID_ARGUMENT,

    /** 资源标识不以命名空间根开头（配置与数据不一致） */
    PREFIX_MISMATCH,

    /** 资源写出失败 */
    EXTRACTION_FAILURE,

    /** 资源包无法加载，初始化中止 */
    PACKAGE_LOAD_FAILURE,

    /** 缓存根目录无法创建或删除 */
    DIRECTORY_LIFECYCLE_FAILURE;

    /**
     * 是否属于调用方输入问题（对外映射为 400）
     */
    public boolean isClientError() {
        return this == INVALID_ARGUMENT || this == PREFIX_MISMATCH;
    }
}
