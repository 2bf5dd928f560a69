package com.genesisgate.auth.web;

import com.genesisgate.auth.config.AuthProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 鉴权拦截器挂在 protected-paths 上，排除 public-paths。
 *
 * <p>顺序固定为：限流（{@link com.genesisgate.common.ratelimit.RateLimitConfig#INTERCEPTOR_ORDER}）在前，鉴权在后。</p>
 */
@Configuration
public class WebMvcAuthConfig implements WebMvcConfigurer {

    public static final int INTERCEPTOR_ORDER = 0;

    private final AccessTokenInterceptor accessTokenInterceptor;
    private final AuthProperties props;

    public WebMvcAuthConfig(AccessTokenInterceptor accessTokenInterceptor, AuthProperties props) {
        this.accessTokenInterceptor = accessTokenInterceptor;
        this.props = props;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessTokenInterceptor)
                .addPathPatterns(props.protectedPaths())
                .excludePathPatterns(props.publicPaths())
                .order(INTERCEPTOR_ORDER);
    }
}
