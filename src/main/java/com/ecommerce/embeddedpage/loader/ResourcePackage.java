package com.ecommerce.embeddedpage.loader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 已加载的资源包（JAR 或已展开的类目录）
 * 资源以点分标识对外暴露：条目 {@code com/acme/pages/Index.jspx} 的标识为 {@code com.acme.pages.Index.jspx}
 */
public interface ResourcePackage extends AutoCloseable {

    /** 资源包标识 */
    String name();

    /**
     * 资源包声明的全部资源标识，保持包自身的枚举顺序
     */
    List<String> resourceNames();

    /**
     * 打开资源字节流
     * @return 资源不存在时返回 null
     */
    InputStream open(String resourceName) throws IOException;

    @Override
    void close();

    /**
     * 条目名 -> 点分资源标识
     */
    static String toResourceName(String entryName) {
        String name = entryName.replace('\\', '/');
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return name.replace('/', '.');
    }
}
