package com.genesisgate.common.ratelimit;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig implements WebMvcConfigurer {

    /** 先于鉴权拦截器执行，未登录的暴力请求也会被计数。 */
    public static final int INTERCEPTOR_ORDER = -100;

    private final RateLimitInterceptor rateLimitInterceptor;
    private final RateLimitProperties props;

    public RateLimitConfig(RateLimitInterceptor rateLimitInterceptor, RateLimitProperties props) {
        this.rateLimitInterceptor = rateLimitInterceptor;
        this.props = props;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor)
                .addPathPatterns(props.getIncludePaths())
                .excludePathPatterns(props.getExcludePaths())
                .order(INTERCEPTOR_ORDER);
    }
}
