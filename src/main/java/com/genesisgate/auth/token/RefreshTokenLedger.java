package com.genesisgate.auth.token;

import java.time.Instant;
import java.util.Optional;

/**
 * refreshToken 台账。
 *
 * <p>实现只依赖单 key 原子操作；存储不可用时直接抛出
 * {@link org.springframework.dao.DataAccessException}，由 {@link TokenService} 决定 fail-closed。</p>
 */
public interface RefreshTokenLedger {

    enum Outcome {
        /** 本次调用把记录从有效改为已撤销。 */
        REVOKED_NOW,
        ALREADY_REVOKED,
        NOT_FOUND
    }

    /**
     * @param record 撤销后的记录（ALREADY_REVOKED 时保留原撤销原因）；NOT_FOUND 时为 null
     */
    record RevokeResult(Outcome outcome, RefreshRecord record) {

        public static RevokeResult notFound() {
            return new RevokeResult(Outcome.NOT_FOUND, null);
        }
    }

    void save(RefreshRecord record);

    Optional<RefreshRecord> find(String tokenHash);

    /**
     * 原子地“检查未撤销并标记撤销”。轮换时以 {@link RevokeReason#ROTATED} 调用，
     * 两个并发请求拿同一个 token 只会有一个得到 REVOKED_NOW。
     */
    RevokeResult revoke(String tokenHash, RevokeReason reason, Instant now);

    /** 撤销会话内所有未撤销的记录，返回撤销条数。 */
    int revokeSession(String sessionId, RevokeReason reason, Instant now);

    int revokeAllForUser(String userId, RevokeReason reason, Instant now);
}
