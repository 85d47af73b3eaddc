package com.ecommerce.embeddedpage.config;

import com.ecommerce.embeddedpage.constant.EmbeddedPageConstants;
import com.ecommerce.embeddedpage.controller.EmbeddedPageServlet;
import com.ecommerce.embeddedpage.render.RenderingPipeline;
import com.ecommerce.embeddedpage.render.RenderingPipelines;
import com.ecommerce.embeddedpage.service.RequestRouter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 嵌入页面 Servlet 注册
 */
@Configuration
public class EmbeddedPageWebConfig {

    @Bean
    public ServletRegistrationBean<EmbeddedPageServlet> embeddedPageServlet(
            RequestRouter requestRouter,
            EmbeddedPageProperties properties,
            ObjectProvider<RenderingPipeline> hostPipelines,
            MeterRegistry meterRegistry) {
        RenderingPipeline pipeline = RenderingPipelines.resolve(hostPipelines, properties.getContentType());
        EmbeddedPageServlet servlet = new EmbeddedPageServlet(requestRouter, properties, pipeline, meterRegistry);

        ServletRegistrationBean<EmbeddedPageServlet> registration =
            new ServletRegistrationBean<>(servlet, properties.getUrlPatterns().toArray(new String[0]));
        registration.setName(EmbeddedPageConstants.SERVLET_NAME);
        registration.setLoadOnStartup(1);
        return registration;
    }
}
