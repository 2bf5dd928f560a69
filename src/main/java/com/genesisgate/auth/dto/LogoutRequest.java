package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record LogoutRequest(
        @JsonProperty("refresh_token") @NotBlank(message = "refresh_token_required") String refreshToken
) {
}
