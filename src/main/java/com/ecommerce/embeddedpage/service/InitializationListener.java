package com.ecommerce.embeddedpage.service;

import com.ecommerce.embeddedpage.model.CacheSnapshot;

import java.time.Duration;

/**
 * 初始化过程监听器，所有方法默认空实现
 * 监听器抛出的异常会被记录并忽略，不影响初始化结果
 */
public interface InitializationListener {

    default void onInitialized(CacheSnapshot snapshot, Duration duration) {}

    default void onInitializationFailure(Throwable cause, Duration duration) {}

    default void onTeardown() {}
}
