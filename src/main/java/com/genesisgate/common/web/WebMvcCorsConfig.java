package com.genesisgate.common.web;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 前端跨域访问：只放行配置的 origin。
 *
 * <p>限流相关的响应头需要 expose，否则浏览器端读不到。</p>
 */
@Configuration
@EnableConfigurationProperties(CorsProperties.class)
public class WebMvcCorsConfig implements WebMvcConfigurer {

    private final CorsProperties props;

    public WebMvcCorsConfig(CorsProperties props) {
        this.props = props;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(props.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "Accept", "Origin", "Cache-Control", "X-Requested-With")
                .exposedHeaders("X-RateLimit-Limit", "X-RateLimit-Remaining", "Retry-After")
                .allowCredentials(true)
                .maxAge(props.getMaxAgeSeconds());
    }
}
