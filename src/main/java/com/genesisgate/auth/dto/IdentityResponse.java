package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.genesisgate.auth.token.Identity;

public record IdentityResponse(
        @JsonProperty("user_id") String userId,
        String email,
        String username,
        String role
) {
    public static IdentityResponse of(Identity identity) {
        return new IdentityResponse(identity.userId(), identity.email(), identity.username(), identity.role());
    }
}
