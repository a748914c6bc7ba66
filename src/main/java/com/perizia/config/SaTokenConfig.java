package com.perizia.config;

import cn.dev33.satoken.filter.SaTokenContextFilterForJakartaServlet;
import cn.dev33.satoken.interceptor.SaInterceptor;
import cn.dev33.satoken.router.SaRouter;
import cn.dev33.satoken.stp.StpUtil;
import jakarta.servlet.DispatcherType;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.EnumSet;

/**
 * Sa-Token 配置类
 * /tasks/** 由服务身份令牌单独校验，/files/download 由签名校验
 *
 * @author perizia
 * @since 2025-03-02
 */
@Configuration
public class SaTokenConfig implements WebMvcConfigurer {

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        // 打开注解式鉴权，其余路径统一要求登录
        registry.addInterceptor(new SaInterceptor(handle -> SaRouter.match("/**")
                .notMatch(
                        "/error",
                        // 内部任务回调
                        "/tasks/**",
                        // 签名下载
                        "/files/download",
                        // 接口文档
                        "/favicon.ico",
                        "/swagger-ui.html",
                        "/swagger-ui/**",
                        "/v3/api-docs/**"
                )
                .check(r -> StpUtil.checkLogin())))
            .addPathPatterns("/**");
    }

    /**
     * 注册 SaToken 上下文 Filter，支持异步请求
     */
    @Bean
    public FilterRegistrationBean<SaTokenContextFilterForJakartaServlet> saTokenContextFilterForJakartaServlet() {
        FilterRegistrationBean<SaTokenContextFilterForJakartaServlet> bean =
            new FilterRegistrationBean<>(new SaTokenContextFilterForJakartaServlet());
        bean.addUrlPatterns("/*");
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        bean.setAsyncSupported(true);
        bean.setDispatcherTypes(EnumSet.of(DispatcherType.ASYNC, DispatcherType.REQUEST));
        return bean;
    }
}
