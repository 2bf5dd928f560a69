package com.genesisgate.common.ratelimit;

import com.genesisgate.support.RedisContainerSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FixedWindowRateLimiterRedisTest extends RedisContainerSupport {

    private final RateLimitPolicy strict = new RateLimitPolicy("strict", 900, 5, "Too many attempts, please try again later");

    private FixedWindowRateLimiter limiter;
    private String key;

    @BeforeEach
    void setUp() {
        limiter = new FixedWindowRateLimiter(redis, RateLimitTestSupport.props());
        key = limiter.key(strict, "1.2.3.4", "/auth/refresh");
    }

    @Test
    void check_ShouldAllowFiveThenReject() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision d = limiter.check("1.2.3.4", "/auth/refresh", strict);
            assertThat(d.allowed()).isTrue();
            assertThat(d.enforced()).isTrue();
            assertThat(d.remaining()).isEqualTo(5 - i);
        }

        RateLimitDecision blocked = limiter.check("1.2.3.4", "/auth/refresh", strict);

        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.remaining()).isZero();
        assertThat(blocked.retryAfterSeconds()).isBetween(1L, 900L);
        assertThat(redis.opsForValue().get(key)).isEqualTo("6");
    }

    @Test
    void check_ShouldSetWindowOnFirstHit() {
        limiter.check("1.2.3.4", "/auth/refresh", strict);

        assertThat(redis.getExpire(key, TimeUnit.MILLISECONDS)).isBetween(1L, 900_000L);
    }

    @Test
    void check_ShouldNotExtendWindow_OnLaterHits() {
        limiter.check("1.2.3.4", "/auth/refresh", strict);
        redis.expire(key, Duration.ofSeconds(60));

        limiter.check("1.2.3.4", "/auth/refresh", strict);
        limiter.check("1.2.3.4", "/auth/refresh", strict);

        assertThat(redis.getExpire(key, TimeUnit.MILLISECONDS)).isBetween(1L, 60_000L);
    }

    @Test
    void check_ShouldRestoreWindow_WhenKeyHasNoTtl() {
        redis.opsForValue().set(key, "3");
        assertThat(redis.getExpire(key, TimeUnit.MILLISECONDS)).isEqualTo(-1L);

        RateLimitDecision d = limiter.check("1.2.3.4", "/auth/refresh", strict);

        assertThat(d.allowed()).isTrue();
        assertThat(d.remaining()).isEqualTo(1);
        assertThat(redis.getExpire(key, TimeUnit.MILLISECONDS)).isBetween(1L, 900_000L);
    }

    @Test
    void check_ShouldReportRemainingWindowInRetryAfter_WhenRejected() {
        redis.opsForValue().set(key, "5", Duration.ofMillis(30_500));

        RateLimitDecision d = limiter.check("1.2.3.4", "/auth/refresh", strict);

        assertThat(d.allowed()).isFalse();
        assertThat(d.retryAfterSeconds()).isBetween(30L, 31L);
    }
}
