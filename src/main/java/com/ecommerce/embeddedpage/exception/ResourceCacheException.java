package com.ecommerce.embeddedpage.exception;

import lombok.Getter;

/**
 * 资源缓存异常
 * 携带 {@link ErrorKind}，由初始化协调器与请求路由向宿主传播
 */
@Getter
public class ResourceCacheException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public ResourceCacheException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResourceCacheException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ResourceCacheException invalidArgument(String message) {
        return new ResourceCacheException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static ResourceCacheException packageLoadFailure(String packageName, Throwable cause) {
        return new ResourceCacheException(ErrorKind.PACKAGE_LOAD_FAILURE,
            "Unable to load resource package [" + packageName + "]", cause);
    }

    public static ResourceCacheException directoryFailure(String message, Throwable cause) {
        return new ResourceCacheException(ErrorKind.DIRECTORY_LIFECYCLE_FAILURE, message, cause);
    }
}
