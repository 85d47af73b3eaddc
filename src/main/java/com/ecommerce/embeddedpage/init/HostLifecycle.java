package com.ecommerce.embeddedpage.init;

/**
 * 宿主生命周期：允许注册"关闭时"回调
 */
@FunctionalInterface
public interface HostLifecycle {

    void onShutdown(Runnable callback);
}
