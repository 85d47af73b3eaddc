package com.ecommerce.embeddedpage.model;

/**
 * 初始化状态
 * UNINITIALIZED -> INITIALIZING -> READY，teardown 回到 UNINITIALIZED
 */
public enum InitializationState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
