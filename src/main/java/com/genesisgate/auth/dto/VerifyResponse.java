package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.genesisgate.auth.token.Identity;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyResponse(
        boolean valid,
        @JsonProperty("user_id") String userId,
        String role,
        String reason
) {
    public static VerifyResponse ok(Identity identity) {
        return new VerifyResponse(true, identity.userId(), identity.role(), null);
    }

    public static VerifyResponse fail(String reason) {
        return new VerifyResponse(false, null, null, reason);
    }
}
