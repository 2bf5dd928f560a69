package com.genesisgate.common.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * 所有单例就绪后，检查每个 {@link RateLimit} 注解引用的策略都已配置。
 * 配置写错时启动失败，而不是等到请求进来才 500。
 */
@Slf4j
@Component
public class RateLimitPolicyValidator implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final RateLimitInterceptor interceptor;

    public RateLimitPolicyValidator(ListableBeanFactory beanFactory, RateLimitInterceptor interceptor) {
        this.beanFactory = beanFactory;
        this.interceptor = interceptor;
    }

    @Override
    public void afterSingletonsInstantiated() {
        int checked = 0;
        for (RequestMappingHandlerMapping mapping : beanFactory.getBeansOfType(RequestMappingHandlerMapping.class).values()) {
            interceptor.checkPolicies(mapping.getHandlerMethods().values());
            checked += mapping.getHandlerMethods().size();
        }
        log.info("ratelimit policies checked: handlers={}", checked);
    }
}
