package com.ecommerce.embeddedpage.model;

import com.ecommerce.embeddedpage.exception.ErrorKind;
import com.ecommerce.embeddedpage.exception.ResourceCacheException;

import java.util.Objects;

/**
 * 操作结果：成功值或失败描述（错误类型 + 消息 + 可选原因）
 * 路径映射、资源提取、资源目录的校验失败通过该类型返回，而不是抛出异常
 *
 * @param <T> 成功值类型
 */
public final class ResourceResult<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;
    private final Throwable cause;

    private ResourceResult(T value, ErrorKind errorKind, String message, Throwable cause) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
        this.cause = cause;
    }

    public static <T> ResourceResult<T> success(T value) {
        return new ResourceResult<>(Objects.requireNonNull(value, "value"), null, null, null);
    }

    public static <T> ResourceResult<T> failure(ErrorKind kind, String message) {
        return failure(kind, message, null);
    }

    public static <T> ResourceResult<T> failure(ErrorKind kind, String message, Throwable cause) {
        return new ResourceResult<>(null, Objects.requireNonNull(kind, "kind"), message, cause);
    }

    public static <T> ResourceResult<T> invalidArgument(String message) {
        return failure(ErrorKind.INVALID_ARGUMENT, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    /**
     * 成功值
     * @throws IllegalStateException 结果为失败时
     */
    public T get() {
        if (isFailure()) {
            throw new IllegalStateException("No value present, failed with " + errorKind + ": " + message);
        }
        return value;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String message() {
        return message;
    }

    public Throwable cause() {
        return cause;
    }

    /**
     * 成功返回值，失败转换为 {@link ResourceCacheException}
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw new ResourceCacheException(errorKind, message, cause);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "ResourceResult[success=" + value + "]"
            : "ResourceResult[" + errorKind + ": " + message + "]";
    }
}
