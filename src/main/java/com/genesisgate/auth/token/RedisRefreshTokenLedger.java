package com.genesisgate.auth.token;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的 refresh 台账。
 *
 * <p>key 结构：</p>
 * <ul>
 *   <li>{@code gate:refresh:{tokenHash}}：HASH，记录本体；TTL 对齐 token 过期时间</li>
 *   <li>{@code gate:refresh:user:{userId}}：SET of tokenHash，只含未撤销的记录，用于“退出所有设备”</li>
 *   <li>{@code gate:refresh:session:{sessionId}}：SET of tokenHash，会话内未撤销的记录</li>
 * </ul>
 *
 * <p>写入与撤销各是一个 Lua 脚本：记录和两个索引在同一次往返里完成，TTL 与写入同时生效。
 * 撤销时把 tokenHash 从索引里移除，写入时顺带清掉记录已过期的索引成员，索引大小只跟有效记录数相关。
 * refresh TTL 固定，最新写入的记录过期最晚，所以索引的过期时间跟随最新一条。</p>
 *
 * <p>撤销后的记录本体保留到自然过期，这样重放时能区分 REVOKED 与 UNKNOWN。</p>
 *
 * <p>脚本会访问由记录字段拼出的索引 key，因此要求单实例/主从 Redis，不支持 Cluster。</p>
 */
@Slf4j
@Component
public class RedisRefreshTokenLedger implements RefreshTokenLedger {

    static final String KEY_PREFIX = "gate:refresh:";
    static final String KEY_USER_PREFIX = "gate:refresh:user:";
    static final String KEY_SESSION_PREFIX = "gate:refresh:session:";

    static final String F_ID = "id";
    static final String F_USER_ID = "userId";
    static final String F_SESSION_ID = "sessionId";
    static final String F_EMAIL = "email";
    static final String F_USERNAME = "username";
    static final String F_ROLE = "role";
    static final String F_CREATED_AT = "createdAt";
    static final String F_EXPIRES_AT = "expiresAt";
    static final String F_REVOKED = "revoked";
    static final String F_REVOKED_AT = "revokedAt";
    static final String F_REVOKE_REASON = "revokeReason";
    static final String F_IP = "ip";
    static final String F_USER_AGENT = "userAgent";

    private static final DefaultRedisScript<Long> SAVE_SCRIPT = script("""
            redis.call('HSET', KEYS[1], unpack(ARGV, 4))
            redis.call('PEXPIREAT', KEYS[1], ARGV[1])
            for i = 2, 3 do
              for _, h in ipairs(redis.call('SMEMBERS', KEYS[i])) do
                if redis.call('EXISTS', ARGV[3] .. h) == 0 then
                  redis.call('SREM', KEYS[i], h)
                end
              end
              redis.call('SADD', KEYS[i], ARGV[2])
              redis.call('PEXPIREAT', KEYS[i], ARGV[1])
            end
            return 1
            """);

    /** 0 = 不存在，1 = 之前已撤销，2 = 本次撤销。 */
    private static final DefaultRedisScript<Long> REVOKE_SCRIPT = script("""
            if redis.call('EXISTS', KEYS[1]) == 0 then
              return 0
            end
            if redis.call('HGET', KEYS[1], 'revoked') == '1' then
              return 1
            end
            redis.call('HSET', KEYS[1], 'revoked', '1', 'revokedAt', ARGV[1], 'revokeReason', ARGV[2])
            local uid = redis.call('HGET', KEYS[1], 'userId')
            local sid = redis.call('HGET', KEYS[1], 'sessionId')
            if uid then
              redis.call('SREM', ARGV[3] .. uid, ARGV[5])
            end
            if sid then
              redis.call('SREM', ARGV[4] .. sid, ARGV[5])
            end
            return 2
            """);

    private final StringRedisTemplate redis;

    public RedisRefreshTokenLedger(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public void save(RefreshRecord record) {
        List<String> args = new ArrayList<>();
        args.add(String.valueOf(record.expiresAt().toEpochMilli()));
        args.add(record.tokenHash());
        args.add(KEY_PREFIX);
        toHash(record).forEach((field, value) -> {
            args.add(field);
            args.add(value);
        });
        redis.execute(SAVE_SCRIPT,
                List.of(key(record.tokenHash()), userKey(record.userId()), sessionKey(record.sessionId())),
                args.toArray());
    }

    @Override
    public Optional<RefreshRecord> find(String tokenHash) {
        Map<Object, Object> entries = redis.opsForHash().entries(key(tokenHash));
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromHash(tokenHash, entries));
    }

    @Override
    public RevokeResult revoke(String tokenHash, RevokeReason reason, Instant now) {
        Long status = redis.execute(
                REVOKE_SCRIPT,
                List.of(key(tokenHash)),
                String.valueOf(now.toEpochMilli()),
                reason.name(),
                KEY_USER_PREFIX,
                KEY_SESSION_PREFIX,
                tokenHash
        );
        if (status == null || status == 0L) {
            return RevokeResult.notFound();
        }
        Optional<RefreshRecord> record = find(tokenHash);
        if (record.isEmpty()) {
            // 脚本执行后恰好过期
            return RevokeResult.notFound();
        }
        Outcome outcome = status == 2L ? Outcome.REVOKED_NOW : Outcome.ALREADY_REVOKED;
        return new RevokeResult(outcome, record.get());
    }

    @Override
    public int revokeSession(String sessionId, RevokeReason reason, Instant now) {
        return revokeMembers(sessionKey(sessionId), reason, now);
    }

    @Override
    public int revokeAllForUser(String userId, RevokeReason reason, Instant now) {
        int revoked = revokeMembers(userKey(userId), reason, now);
        log.debug("revoked refresh records: userId={}, count={}", userId, revoked);
        return revoked;
    }

    private int revokeMembers(String indexKey, RevokeReason reason, Instant now) {
        Set<String> hashes = redis.opsForSet().members(indexKey);
        if (hashes == null || hashes.isEmpty()) {
            return 0;
        }
        int revoked = 0;
        for (String hash : hashes) {
            RevokeResult result = revoke(hash, reason, now);
            if (result.outcome() == Outcome.REVOKED_NOW) {
                revoked++;
            } else if (result.outcome() == Outcome.NOT_FOUND) {
                redis.opsForSet().remove(indexKey, hash);
            }
        }
        return revoked;
    }

    static Map<String, String> toHash(RefreshRecord r) {
        Map<String, String> m = new HashMap<>();
        m.put(F_ID, r.recordId());
        m.put(F_USER_ID, r.userId());
        m.put(F_SESSION_ID, r.sessionId());
        putIfPresent(m, F_EMAIL, r.email());
        putIfPresent(m, F_USERNAME, r.username());
        putIfPresent(m, F_ROLE, r.role());
        m.put(F_CREATED_AT, String.valueOf(r.createdAt().toEpochMilli()));
        m.put(F_EXPIRES_AT, String.valueOf(r.expiresAt().toEpochMilli()));
        m.put(F_REVOKED, r.revoked() ? "1" : "0");
        if (r.revokedAt() != null) {
            m.put(F_REVOKED_AT, String.valueOf(r.revokedAt().toEpochMilli()));
        }
        if (r.revokeReason() != null) {
            m.put(F_REVOKE_REASON, r.revokeReason().name());
        }
        putIfPresent(m, F_IP, r.ip());
        putIfPresent(m, F_USER_AGENT, r.userAgent());
        return m;
    }

    static RefreshRecord fromHash(String tokenHash, Map<Object, Object> m) {
        String revokedAt = str(m, F_REVOKED_AT);
        String reason = str(m, F_REVOKE_REASON);
        return new RefreshRecord(
                str(m, F_ID),
                tokenHash,
                str(m, F_USER_ID),
                str(m, F_SESSION_ID),
                str(m, F_EMAIL),
                str(m, F_USERNAME),
                str(m, F_ROLE),
                Instant.ofEpochMilli(Long.parseLong(str(m, F_CREATED_AT))),
                Instant.ofEpochMilli(Long.parseLong(str(m, F_EXPIRES_AT))),
                "1".equals(str(m, F_REVOKED)),
                revokedAt == null ? null : Instant.ofEpochMilli(Long.parseLong(revokedAt)),
                reason == null ? null : RevokeReason.valueOf(reason),
                str(m, F_IP),
                str(m, F_USER_AGENT)
        );
    }

    private static void putIfPresent(Map<String, String> m, String field, String value) {
        if (value != null) {
            m.put(field, value);
        }
    }

    private static String str(Map<Object, Object> m, String field) {
        Object v = m.get(field);
        return v == null ? null : v.toString();
    }

    static String key(String tokenHash) {
        return KEY_PREFIX + tokenHash;
    }

    static String userKey(String userId) {
        return KEY_USER_PREFIX + userId;
    }

    static String sessionKey(String sessionId) {
        return KEY_SESSION_PREFIX + sessionId;
    }

    private static DefaultRedisScript<Long> script(String text) {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText(text);
        return s;
    }
}
