package com.genesisgate.common.ratelimit;

import com.genesisgate.common.api.ApiCodes;
import com.genesisgate.common.api.Result;
import com.genesisgate.common.web.ClientIpResolver;
import com.genesisgate.common.web.JsonResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Collection;

/**
 * 按 (客户端 IP, 路由) 做固定窗口限流。
 *
 * <p>策略：接口上有 {@link RateLimit} 用注解指定的策略，否则用 default。
 * 路由取匹配到的 pattern（例如 {@code /auth/admin/users/{userId}/revoke}），避免路径参数把 key 打散。</p>
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";

    private final RateLimitProperties props;
    private final RateLimitPolicies policies;
    private final FixedWindowRateLimiter limiter;
    private final ClientIpResolver clientIpResolver;
    private final JsonResponseWriter responseWriter;

    public RateLimitInterceptor(RateLimitProperties props,
                                FixedWindowRateLimiter limiter,
                                ClientIpResolver clientIpResolver,
                                JsonResponseWriter responseWriter) {
        this.props = props;
        this.policies = RateLimitPolicies.from(props);
        this.limiter = limiter;
        this.clientIpResolver = clientIpResolver;
        this.responseWriter = responseWriter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!props.isEnabled() || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String clientId = clientIpResolver.resolve(request);
        if (clientId == null || clientId.isBlank()) {
            return true;
        }

        RateLimitPolicy policy = resolvePolicy(handler);
        RateLimitDecision decision = limiter.check(clientId, resolveRoute(request), policy);
        if (!decision.enforced()) {
            return true;
        }

        response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
        if (decision.allowed()) {
            return true;
        }

        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        responseWriter.write(response, 429, Result.fail(ApiCodes.TOO_MANY_REQUESTS, policy.message()));
        return false;
    }

    RateLimitPolicy resolvePolicy(Object handler) {
        if (handler instanceof HandlerMethod hm) {
            RateLimit ann = hm.getMethodAnnotation(RateLimit.class);
            if (ann == null) {
                ann = hm.getBeanType().getAnnotation(RateLimit.class);
            }
            if (ann != null) {
                return policies.get(ann.policy());
            }
        }
        return policies.defaultPolicy();
    }

    /** 启动时对所有接口解析一遍策略，注解里写了未配置的策略名直接失败。 */
    void checkPolicies(Collection<HandlerMethod> handlers) {
        for (HandlerMethod hm : handlers) {
            try {
                resolvePolicy(hm);
            } catch (IllegalStateException e) {
                throw new IllegalStateException(e.getMessage() + " (handler " + hm.getShortLogMessage() + ")", e);
            }
        }
    }

    static String resolveRoute(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern != null) {
            return pattern.toString();
        }
        return request.getRequestURI();
    }
}
