package com.genesisgate.common.web;

import com.genesisgate.auth.token.TokenErrorKind;
import com.genesisgate.auth.token.TokenException;
import com.genesisgate.auth.web.RefreshFailedException;
import com.genesisgate.common.api.ApiCodes;
import com.genesisgate.common.api.Result;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "auth/refresh2"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().success()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleRefreshFailed_ShouldHidePreciseKind() {
        ResponseEntity<Result<Void>> resp = handler.handleRefreshFailed(
                new RefreshFailedException(new TokenException(TokenErrorKind.REVOKED, "refresh_token_revoked")));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resp.getBody().error()).isEqualTo("refresh_failed");
    }

    @Test
    void handleToken_ShouldReturn503_WhenDependencyUnavailable() {
        ResponseEntity<Result<Void>> resp = handler.handleToken(
                new TokenException(TokenErrorKind.DEPENDENCY_UNAVAILABLE, "ledger_unavailable"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.SERVICE_UNAVAILABLE);
    }

    @Test
    void handleAny_ShouldNotLeakMessage() {
        ResponseEntity<Result<Void>> resp = handler.handleAny(new IllegalStateException("secret detail"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resp.getBody().error()).isEqualTo("internal_error");
    }
}
