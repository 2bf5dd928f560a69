package com.genesisgate.common.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 启动时从配置构建的不可变策略表；default 与 strict 必须存在。
 */
public final class RateLimitPolicies {

    private final Map<String, RateLimitPolicy> policies;

    public RateLimitPolicies(Map<String, RateLimitPolicy> policies) {
        Map<String, RateLimitPolicy> copy = new LinkedHashMap<>(policies);
        for (String required : new String[]{RateLimit.DEFAULT, RateLimit.STRICT}) {
            if (!copy.containsKey(required)) {
                throw new IllegalStateException("gate.ratelimit.policies." + required + " must be configured");
            }
        }
        this.policies = Map.copyOf(copy);
    }

    public static RateLimitPolicies from(RateLimitProperties props) {
        Map<String, RateLimitPolicy> out = new LinkedHashMap<>();
        props.getPolicies().forEach((name, p) ->
                out.put(name, new RateLimitPolicy(name, p.getWindowSeconds(), p.getMaxRequests(), p.getMessage())));
        return new RateLimitPolicies(out);
    }

    public RateLimitPolicy get(String name) {
        RateLimitPolicy policy = policies.get(name);
        if (policy == null) {
            throw new IllegalStateException("unknown rate limit policy: " + name);
        }
        return policy;
    }

    public RateLimitPolicy defaultPolicy() {
        return policies.get(RateLimit.DEFAULT);
    }
}
