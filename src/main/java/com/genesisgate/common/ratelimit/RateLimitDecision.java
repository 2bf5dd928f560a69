package com.genesisgate.common.ratelimit;

/**
 * 单次限流检查的结果。
 *
 * <p>enforced=false 表示 Redis 不可用、按 fail-open 放行，此时不输出限流响应头。</p>
 */
public record RateLimitDecision(
        boolean allowed,
        boolean enforced,
        long limit,
        long remaining,
        long retryAfterSeconds
) {

    public static RateLimitDecision allowed(RateLimitPolicy policy, long current) {
        long max = policy.maxRequests();
        return new RateLimitDecision(true, true, max, Math.max(0, max - current), 0);
    }

    /** ttlMillis 为窗口剩余毫秒数，向上取整成秒。 */
    public static RateLimitDecision rejected(RateLimitPolicy policy, long ttlMillis) {
        long retryAfter = ttlMillis > 0 ? (ttlMillis + 999) / 1000 : policy.windowSeconds();
        return new RateLimitDecision(false, true, policy.maxRequests(), 0, retryAfter);
    }

    public static RateLimitDecision failOpen(RateLimitPolicy policy) {
        return new RateLimitDecision(true, false, policy.maxRequests(), policy.maxRequests(), 0);
    }
}
