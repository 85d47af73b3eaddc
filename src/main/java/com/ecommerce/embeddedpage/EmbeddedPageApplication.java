package com.ecommerce.embeddedpage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 嵌入页面缓存服务启动类
 * 页面模板可来自文件系统，也可来自配置的 JAR 中提取出的私有缓存
 */
@SpringBootApplication
public class EmbeddedPageApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmbeddedPageApplication.class, args);
    }
}
