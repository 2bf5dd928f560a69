package com.genesisgate.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record VerifyRequest(
        @JsonProperty("access_token") @NotBlank(message = "access_token_required") String accessToken
) {
}
