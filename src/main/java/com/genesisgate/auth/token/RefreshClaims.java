package com.genesisgate.auth.token;

import java.time.Instant;

/**
 * refreshToken 的 claim：只带 userId，不带 email/role。
 */
public record RefreshClaims(
        String userId,
        String tokenId,
        String issuer,
        Instant issuedAt,
        Instant expiresAt
) {
}
