package com.genesisgate.auth.web;

import com.genesisgate.auth.dto.IdentityResponse;
import com.genesisgate.auth.dto.LogoutRequest;
import com.genesisgate.auth.dto.RefreshRequest;
import com.genesisgate.auth.dto.RevokeResponse;
import com.genesisgate.auth.dto.TokenResponse;
import com.genesisgate.auth.dto.VerifyRequest;
import com.genesisgate.auth.dto.VerifyResponse;
import com.genesisgate.auth.token.Identity;
import com.genesisgate.auth.token.RequestMetadata;
import com.genesisgate.auth.token.RevokeReason;
import com.genesisgate.auth.token.TokenErrorKind;
import com.genesisgate.auth.token.TokenException;
import com.genesisgate.auth.token.TokenService;
import com.genesisgate.common.api.Result;
import com.genesisgate.common.ratelimit.RateLimit;
import com.genesisgate.common.web.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * token 生命周期相关 HTTP 接口。
 *
 * <p>登录/注册属于用户服务，成功后由它调用 {@link TokenService#issuePair}；这里只负责换发、撤销与校验。</p>
 */
@Slf4j
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final TokenService tokenService;
    private final ClientIpResolver clientIpResolver;

    public AuthController(TokenService tokenService, ClientIpResolver clientIpResolver) {
        this.tokenService = tokenService;
        this.clientIpResolver = clientIpResolver;
    }

    /**
     * 用 refreshToken 换发新的一对 token；旧 refreshToken 立即作废。
     */
    @PostMapping("/refresh")
    @RateLimit(policy = RateLimit.STRICT)
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        try {
            return TokenResponse.of(tokenService.refresh(request.refreshToken(), metadata(httpRequest)));
        } catch (TokenException e) {
            if (e.kind() == TokenErrorKind.DEPENDENCY_UNAVAILABLE) {
                throw e;
            }
            log.info("refresh rejected: kind={}, ip={}", e.kind(), clientIpResolver.resolve(httpRequest));
            throw new RefreshFailedException(e);
        }
    }

    @PostMapping("/logout")
    public Result<Void> logout(@Valid @RequestBody LogoutRequest request) {
        // token 不存在也返回成功，不暴露 token 是否有效
        tokenService.revoke(request.refreshToken());
        return Result.okVoid();
    }

    @PostMapping("/logout-all")
    public Result<RevokeResponse> logoutAll() {
        Identity identity = AuthContext.require();
        return Result.ok(new RevokeResponse(tokenService.revokeAll(identity.userId(), RevokeReason.LOGOUT)));
    }

    @GetMapping("/me")
    public Result<IdentityResponse> me() {
        return Result.ok(IdentityResponse.of(AuthContext.require()));
    }

    /**
     * 给网关/内部服务调用：校验 accessToken 并返回身份。无效 token 也返回 200，由 valid 字段表达。
     */
    @PostMapping("/verify")
    public Result<VerifyResponse> verify(@Valid @RequestBody VerifyRequest request) {
        try {
            return Result.ok(VerifyResponse.ok(tokenService.validateAccess(request.accessToken())));
        } catch (TokenException e) {
            String reason = e.kind() == TokenErrorKind.EXPIRED ? "token_expired" : "invalid_token";
            return Result.ok(VerifyResponse.fail(reason));
        }
    }

    @PostMapping("/admin/users/{userId}/revoke")
    @RequireRole("admin")
    public Result<RevokeResponse> adminRevoke(@PathVariable("userId") String userId) {
        Identity admin = AuthContext.require();
        log.info("admin revoke: adminId={}, userId={}", admin.userId(), userId);
        return Result.ok(new RevokeResponse(tokenService.revokeAll(userId, RevokeReason.ADMIN)));
    }

    private RequestMetadata metadata(HttpServletRequest request) {
        return new RequestMetadata(clientIpResolver.resolve(request), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
