package com.genesisgate.auth.token;

import java.time.Instant;

public record AccessClaims(
        String userId,
        String email,
        String username,
        String role,
        String tokenId,
        String issuer,
        Instant issuedAt,
        Instant expiresAt
) {
    public Identity toIdentity() {
        return new Identity(userId, email, username, role);
    }
}
