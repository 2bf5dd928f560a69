package com.genesisgate.auth.dto;

public record RevokeResponse(int revoked) {
}
