package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RefreshRequest(
        @JsonProperty("refresh_token") @NotBlank(message = "refresh_token_required") String refreshToken
) {
}
