package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.genesisgate.auth.token.TokenPair;
import com.genesisgate.auth.token.TokenService;

/**
 * refresh 接口的响应体（OAuth2 风格的 snake_case 字段）。
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
) {
    public static TokenResponse of(TokenPair pair) {
        return new TokenResponse(pair.accessToken(), pair.refreshToken(), TokenService.TOKEN_TYPE,
                pair.accessTokenExpiresInSeconds());
    }
}
