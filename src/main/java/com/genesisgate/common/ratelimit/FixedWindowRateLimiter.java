package com.genesisgate.common.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 固定窗口计数器（Redis）。
 *
 * <p>INCR 与设置过期在同一个 Lua 脚本里完成：</p>
 * <ul>
 *   <li>计数从 0 变 1 时设置窗口过期时间，之后的请求不会延长窗口</li>
 *   <li>key 没有过期时间（历史遗留/异常中断）时补设，避免永久封禁</li>
 * </ul>
 *
 * <p>脚本返回一个整数：未超限时为当前计数；超限时为剩余窗口毫秒数取负（至少 -1）。</p>
 *
 * <p>Redis 不可用或超时一律 fail-open：限流依赖故障不能变成被保护服务的整体故障。</p>
 */
@Slf4j
@Component
public class FixedWindowRateLimiter {

    private static final DefaultRedisScript<Long> SCRIPT = buildScript();

    private final StringRedisTemplate redis;
    private final RateLimitProperties props;

    public FixedWindowRateLimiter(StringRedisTemplate redis, RateLimitProperties props) {
        this.redis = redis;
        this.props = props;
    }

    public RateLimitDecision check(String clientId, String routeId, RateLimitPolicy policy) {
        String key = key(policy, clientId, routeId);
        try {
            Long reply = redis.execute(SCRIPT, List.of(key),
                    String.valueOf(policy.windowSeconds() * 1000), String.valueOf(policy.maxRequests()));
            if (reply == null) {
                log.warn("ratelimit script returned no result, fail-open: policy={}, key={}", policy.name(), key);
                return RateLimitDecision.failOpen(policy);
            }
            return reply > 0 ? RateLimitDecision.allowed(policy, reply) : RateLimitDecision.rejected(policy, -reply);
        } catch (RuntimeException e) {
            log.warn("ratelimit redis failed, fail-open: policy={}, key={}, err={}", policy.name(), key, e.toString());
            return RateLimitDecision.failOpen(policy);
        }
    }

    String key(RateLimitPolicy policy, String clientId, String routeId) {
        String prefix = props.getKeyPrefix() == null ? "" : props.getKeyPrefix();
        return prefix + policy.name() + ":" + clientId + ":" + routeId;
    }

    private static DefaultRedisScript<Long> buildScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local c = redis.call('INCR', KEYS[1])
                local ttl = redis.call('PTTL', KEYS[1])
                if c == 1 or ttl < 0 then
                  redis.call('PEXPIRE', KEYS[1], ARGV[1])
                  ttl = tonumber(ARGV[1])
                end
                if c <= tonumber(ARGV[2]) then
                  return c
                end
                return -math.max(ttl, 1)
                """);
        return s;
    }
}
