package com.genesisgate.auth.web;

import com.genesisgate.auth.token.Identity;
import com.genesisgate.auth.token.TokenErrorKind;
import com.genesisgate.auth.token.TokenException;
import com.genesisgate.auth.token.TokenService;
import com.genesisgate.common.api.ApiCodes;
import com.genesisgate.common.api.Result;
import com.genesisgate.common.web.JsonResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 受保护路由的鉴权拦截器（fail-closed）。
 *
 * <ul>
 *   <li>没有 Bearer token：401 no_token</li>
 *   <li>token 过期：401 token_expired（客户端应走 /auth/refresh）</li>
 *   <li>结构/签名/算法不对：401 invalid_token</li>
 *   <li>其他异常：500 internal_error</li>
 *   <li>通过：把 {@link Identity} 放到 request attribute 与 {@link AuthContext}</li>
 * </ul>
 *
 * <p>校验只做本地验签，不访问 Redis，所以 Redis 故障不影响已签发 accessToken 的使用。</p>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_IDENTITY = "gate.identity";

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final JsonResponseWriter responseWriter;

    public AccessTokenInterceptor(TokenService tokenService, JsonResponseWriter responseWriter) {
        this.tokenService = tokenService;
        this.responseWriter = responseWriter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String token = extractBearer(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            responseWriter.write(response, 401, Result.fail(ApiCodes.UNAUTHORIZED, "no_token"));
            return false;
        }

        Identity identity;
        try {
            identity = tokenService.validateAccess(token);
        } catch (TokenException e) {
            if (e.kind() == TokenErrorKind.EXPIRED) {
                responseWriter.write(response, 401, Result.fail(ApiCodes.TOKEN_EXPIRED, "token_expired"));
                return false;
            }
            if (isValidationFailure(e.kind())) {
                log.debug("access token rejected: path={}, kind={}", request.getRequestURI(), e.kind());
                responseWriter.write(response, 401, Result.fail(ApiCodes.UNAUTHORIZED, "invalid_token"));
                return false;
            }
            log.error("access token check failed: path={}, kind={}", request.getRequestURI(), e.kind(), e);
            responseWriter.write(response, 500, Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
            return false;
        } catch (RuntimeException e) {
            log.error("access token check failed: path={}", request.getRequestURI(), e);
            responseWriter.write(response, 500, Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
            return false;
        }

        RequireRole requireRole = resolveRequireRole(handler);
        if (requireRole != null && !identity.hasRole(requireRole.value())) {
            log.debug("role check failed: path={}, userId={}, required={}",
                    request.getRequestURI(), identity.userId(), requireRole.value());
            responseWriter.write(response, 403, Result.fail(ApiCodes.FORBIDDEN, "forbidden"));
            return false;
        }

        request.setAttribute(REQ_ATTR_IDENTITY, identity);
        AuthContext.set(identity);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    static String extractBearer(String header) {
        if (header == null || header.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static boolean isValidationFailure(TokenErrorKind kind) {
        return kind == TokenErrorKind.MALFORMED
                || kind == TokenErrorKind.SIGNATURE_INVALID
                || kind == TokenErrorKind.ALGORITHM_MISMATCH;
    }

    private static RequireRole resolveRequireRole(Object handler) {
        if (!(handler instanceof HandlerMethod hm)) {
            return null;
        }
        RequireRole ann = hm.getMethodAnnotation(RequireRole.class);
        return ann != null ? ann : hm.getBeanType().getAnnotation(RequireRole.class);
    }
}
