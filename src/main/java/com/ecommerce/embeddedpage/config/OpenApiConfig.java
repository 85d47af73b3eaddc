package com.ecommerce.embeddedpage.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 3.0 文档配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI embeddedPageOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("嵌入页面缓存 API")
                .version("1.0.0")
                .description("""
                    嵌入页面缓存运维 API

                    ## 工作方式
                    - 启动或首个请求时，把配置的 JAR 中的页面模板提取到私有临时目录
                    - 请求到来时，按配置优先使用文件系统页面，否则使用提取缓存
                    - 应用关闭时删除缓存目录
                    """))
            .servers(List.of(
                new Server().url("http://localhost:8080").description("本地开发环境")
            ));
    }
}
