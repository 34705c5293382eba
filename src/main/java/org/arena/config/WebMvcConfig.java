package org.arena.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC 配置
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final ArenaProperties arenaProperties;

    public WebMvcConfig(ArenaProperties arenaProperties) {
        this.arenaProperties = arenaProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(arenaProperties))
                .addPathPatterns("/v1/chat/**", "/v1/models", "/admin/**");
        // 扩展推送使用独立的密钥，在请求体校验之前拦截
        registry.addInterceptor(new ExtensionSecretInterceptor(arenaProperties))
                .addPathPatterns("/v1/extension/push");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
