package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.init.ContextClosedHostLifecycle;
import com.ecommerce.embeddedpage.loader.ClasspathPackageLoader;
import com.ecommerce.embeddedpage.loader.PackageLoader;
import com.ecommerce.embeddedpage.service.CacheDirectory;
import com.ecommerce.embeddedpage.service.InitializationCoordinator;
import com.ecommerce.embeddedpage.service.PathMapper;
import com.ecommerce.embeddedpage.service.RequestRouter;
import com.ecommerce.embeddedpage.service.ResourceCatalog;
import com.ecommerce.embeddedpage.service.ResourceExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 嵌入页面核心组件装配
 */
@Configuration
public class EmbeddedPageConfig {

    @Bean
    public ContextClosedHostLifecycle hostLifecycle() {
        return new ContextClosedHostLifecycle();
    }

    @Bean
    public PackageLoader packageLoader() {
        return new ClasspathPackageLoader();
    }

    @Bean
    public ResourceCatalog resourceCatalog(EmbeddedPageProperties properties) {
        return new ResourceCatalog(properties.getPageExtension());
    }

    @Bean
    public PathMapper pathMapper() {
        return new PathMapper();
    }

    @Bean
    public ResourceExtractor resourceExtractor() {
        return new ResourceExtractor();
    }

    @Bean
    public CacheDirectory cacheDirectory(EmbeddedPageProperties properties) {
        return new CacheDirectory(properties.tempDirPath(), properties.getTempDirPrefix());
    }

    @Bean
    public InitializationCoordinator initializationCoordinator(CacheDirectory cacheDirectory,
                                                               EmbeddedPageProperties properties,
                                                               PackageLoader packageLoader,
                                                               ResourceCatalog resourceCatalog,
                                                               PathMapper pathMapper,
                                                               ResourceExtractor resourceExtractor) {
        return new InitializationCoordinator(cacheDirectory, properties, packageLoader,
            resourceCatalog, pathMapper, resourceExtractor);
    }

    @Bean
    public RequestRouter requestRouter(InitializationCoordinator coordinator,
                                       ContextClosedHostLifecycle hostLifecycle,
                                       EmbeddedPageProperties properties) {
        return new RequestRouter(coordinator, hostLifecycle, properties.documentRootPath());
    }
}
