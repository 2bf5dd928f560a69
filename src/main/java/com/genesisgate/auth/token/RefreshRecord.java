package com.genesisgate.auth.token;

import java.time.Instant;

/**
 * refresh 台账中的一条记录（一个 refreshToken 一条）。
 *
 * <p>sessionId 把一次登录后的轮换链串起来；email/username/role 是签发时的身份快照，
 * 轮换时用它重新签发 accessToken。</p>
 */
public record RefreshRecord(
        String recordId,
        String tokenHash,
        String userId,
        String sessionId,
        String email,
        String username,
        String role,
        Instant createdAt,
        Instant expiresAt,
        boolean revoked,
        Instant revokedAt,
        RevokeReason revokeReason,
        String ip,
        String userAgent
) {

    public static RefreshRecord issued(String recordId,
                                       String tokenHash,
                                       String sessionId,
                                       Identity identity,
                                       Instant createdAt,
                                       Instant expiresAt,
                                       RequestMetadata metadata) {
        RequestMetadata meta = metadata == null ? RequestMetadata.UNKNOWN : metadata;
        return new RefreshRecord(recordId, tokenHash, identity.userId(), sessionId,
                identity.email(), identity.username(), identity.role(),
                createdAt, expiresAt, false, null, null, meta.ip(), meta.userAgent());
    }

    public RefreshRecord revoke(RevokeReason reason, Instant at) {
        return new RefreshRecord(recordId, tokenHash, userId, sessionId, email, username, role,
                createdAt, expiresAt, true, at, reason, ip, userAgent);
    }

    public Identity identity() {
        return new Identity(userId, email, username, role);
    }
}
