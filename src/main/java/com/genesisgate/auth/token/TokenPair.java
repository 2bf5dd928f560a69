package com.genesisgate.auth.token;

public record TokenPair(
        String accessToken,
        String refreshToken,
        long accessTokenExpiresInSeconds
) {
}
