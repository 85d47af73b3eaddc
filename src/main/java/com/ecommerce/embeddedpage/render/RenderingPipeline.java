package com.ecommerce.embeddedpage.render;

import com.ecommerce.embeddedpage.model.ResolvedTarget;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * 渲染管线：把解析后的物理路径变成响应
 * 文件是否存在由管线判断，路由层不关心
 */
@FunctionalInterface
public interface RenderingPipeline {

    void render(ResolvedTarget target, HttpServletRequest request, HttpServletResponse response)
        throws IOException, ServletException;
}
