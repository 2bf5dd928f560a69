package com.genesisgate.auth.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * JWT 编解码：无状态，只依赖传入的密钥和时钟。
 *
 * <p>解码时的校验顺序：</p>
 * <ul>
 *   <li>结构：三段式、header 是 Base64URL JSON，否则 MALFORMED</li>
 *   <li>算法：header.alg 必须严格等于 HS256，否则 ALGORITHM_MISMATCH（在验签之前做）</li>
 *   <li>签名：不匹配为 SIGNATURE_INVALID</li>
 *   <li>过期：now &gt; exp 为 EXPIRED，不留时钟偏差</li>
 *   <li>issuer / typ / 必需 claim：不满足为 MALFORMED</li>
 * </ul>
 *
 * <p>access 与 refresh 必须使用不同的密钥，由调用方保证。</p>
 */
@Component
public class JwtCodec {

    public static final String ALGORITHM = "HS256";

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_TOKEN_TYPE = "typ";

    public static final String TOKEN_TYPE_ACCESS = "access";
    public static final String TOKEN_TYPE_REFRESH = "refresh";

    private static final ObjectMapper HEADER_MAPPER = new ObjectMapper();

    private final Clock clock;

    public JwtCodec(Clock clock) {
        this.clock = clock;
    }

    public static SecretKey hmacKey(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String encodeAccess(AccessClaims claims, SecretKey key) {
        return Jwts.builder()
                .id(claims.tokenId())
                .issuer(claims.issuer())
                .subject(claims.userId())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_EMAIL, claims.email())
                .claim(CLAIM_USERNAME, claims.username())
                .claim(CLAIM_ROLE, claims.role())
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS)
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public String encodeRefresh(RefreshClaims claims, SecretKey key) {
        return Jwts.builder()
                .id(claims.tokenId())
                .issuer(claims.issuer())
                .subject(claims.userId())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_REFRESH)
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public AccessClaims decodeAccess(String token, SecretKey key, String expectedIssuer) {
        Claims claims = verify(token, key, expectedIssuer, TOKEN_TYPE_ACCESS);
        try {
            return new AccessClaims(
                    requireText(claims.getSubject(), "sub"),
                    requirePresent(claims.get(CLAIM_EMAIL, String.class), CLAIM_EMAIL),
                    requirePresent(claims.get(CLAIM_USERNAME, String.class), CLAIM_USERNAME),
                    requireText(claims.get(CLAIM_ROLE, String.class), CLAIM_ROLE),
                    claims.getId(),
                    claims.getIssuer(),
                    toInstant(claims.getIssuedAt(), "iat"),
                    toInstant(claims.getExpiration(), "exp")
            );
        } catch (JwtException e) {
            throw new TokenException(TokenErrorKind.MALFORMED, "invalid_claims", e);
        }
    }

    public RefreshClaims decodeRefresh(String token, SecretKey key, String expectedIssuer) {
        Claims claims = verify(token, key, expectedIssuer, TOKEN_TYPE_REFRESH);
        return new RefreshClaims(
                requireText(claims.getSubject(), "sub"),
                requireText(claims.getId(), "jti"),
                claims.getIssuer(),
                toInstant(claims.getIssuedAt(), "iat"),
                toInstant(claims.getExpiration(), "exp")
        );
    }

    private Claims verify(String token, SecretKey key, String expectedIssuer, String expectedType) {
        requireExpectedAlgorithm(token);

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .requireIssuer(expectedIssuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenException(TokenErrorKind.EXPIRED, "token_expired", e);
        } catch (SecurityException e) {
            throw new TokenException(TokenErrorKind.SIGNATURE_INVALID, "signature_invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenException(TokenErrorKind.MALFORMED, "malformed_token", e);
        }

        Object typ = claims.get(CLAIM_TOKEN_TYPE);
        if (!expectedType.equals(typ)) {
            throw new TokenException(TokenErrorKind.MALFORMED, "unexpected_token_type");
        }
        return claims;
    }

    /**
     * 算法白名单：只认 HS256。
     *
     * <p>必须在交给 jjwt 验签之前完成，防止 alg=none 或非对称算法的混淆攻击。</p>
     */
    static void requireExpectedAlgorithm(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenErrorKind.MALFORMED, "empty_token");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenException(TokenErrorKind.MALFORMED, "malformed_token");
        }

        JsonNode header;
        try {
            header = HEADER_MAPPER.readTree(Decoders.BASE64URL.decode(parts[0]));
        } catch (Exception e) {
            throw new TokenException(TokenErrorKind.MALFORMED, "malformed_header", e);
        }
        if (header == null || !header.isObject()) {
            throw new TokenException(TokenErrorKind.MALFORMED, "malformed_header");
        }

        JsonNode alg = header.get("alg");
        if (alg == null || !alg.isTextual() || !ALGORITHM.equals(alg.asText())) {
            throw new TokenException(TokenErrorKind.ALGORITHM_MISMATCH, "unexpected_algorithm");
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new TokenException(TokenErrorKind.MALFORMED, "missing_" + name);
        }
        return value;
    }

    private static String requirePresent(String value, String name) {
        if (value == null) {
            throw new TokenException(TokenErrorKind.MALFORMED, "missing_" + name);
        }
        return value;
    }

    private static Instant toInstant(Date date, String name) {
        if (date == null) {
            throw new TokenException(TokenErrorKind.MALFORMED, "missing_" + name);
        }
        return date.toInstant();
    }
}
