package com.genesisgate.auth.token;

import com.genesisgate.support.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtCodecTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final JwtCodec codec = new JwtCodec(clock);
    private final SecretKey accessKey = JwtCodec.hmacKey(TokenFixtures.ACCESS_SECRET);
    private final SecretKey refreshKey = JwtCodec.hmacKey(TokenFixtures.REFRESH_SECRET);

    @Test
    void decodeAccess_ShouldReturnEncodedClaims() {
        AccessClaims claims = access(T0, 900);
        String token = codec.encodeAccess(claims, accessKey);

        AccessClaims decoded = codec.decodeAccess(token, accessKey, TokenFixtures.ISSUER);
        assertThat(decoded).isEqualTo(claims);
        assertThat(decoded.toIdentity()).isEqualTo(new Identity("u1", "u1@example.com", "alice", "user"));
    }

    @Test
    void decodeAccess_ShouldFailSignature_WhenKeyDiffers() {
        String token = codec.encodeAccess(access(T0, 900), accessKey);
        SecretKey other = JwtCodec.hmacKey("another-secret-another-secret-another-secret-xx");

        assertKind(() -> codec.decodeAccess(token, other, TokenFixtures.ISSUER), TokenErrorKind.SIGNATURE_INVALID);
    }

    @Test
    void decodeAccess_ShouldRejectAlgNone() {
        String header = b64("{\"alg\":\"none\",\"typ\":\"JWT\"}");
        String payload = b64("{\"sub\":\"u1\",\"role\":\"admin\",\"iss\":\"genesis-music\",\"typ\":\"access\"}");

        assertKind(() -> codec.decodeAccess(header + "." + payload + ".", accessKey, TokenFixtures.ISSUER),
                TokenErrorKind.ALGORITHM_MISMATCH);
    }

    @Test
    void decodeAccess_ShouldRejectOtherHmacAlgorithm() {
        SecretKey hs512Key = Keys.hmacShaKeyFor(
                "0123456789012345678901234567890123456789012345678901234567890123".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject("u1")
                .issuer(TokenFixtures.ISSUER)
                .expiration(Date.from(T0.plusSeconds(900)))
                .signWith(hs512Key, Jwts.SIG.HS512)
                .compact();

        assertKind(() -> codec.decodeAccess(token, accessKey, TokenFixtures.ISSUER), TokenErrorKind.ALGORITHM_MISMATCH);
    }

    @Test
    void decodeAccess_ShouldBeExpired_OneSecondAfterExp() {
        String token = codec.encodeAccess(access(T0, 900), accessKey);

        clock.advance(Duration.ofSeconds(899));
        assertThat(codec.decodeAccess(token, accessKey, TokenFixtures.ISSUER).userId()).isEqualTo("u1");

        clock.advance(Duration.ofSeconds(2));
        assertKind(() -> codec.decodeAccess(token, accessKey, TokenFixtures.ISSUER), TokenErrorKind.EXPIRED);
    }

    @Test
    void decodeAccess_ShouldBeMalformed_WhenNotAJwt() {
        assertKind(() -> codec.decodeAccess("not-a-token", accessKey, TokenFixtures.ISSUER), TokenErrorKind.MALFORMED);
        assertKind(() -> codec.decodeAccess("a.b.c", accessKey, TokenFixtures.ISSUER), TokenErrorKind.MALFORMED);
        assertKind(() -> codec.decodeAccess("", accessKey, TokenFixtures.ISSUER), TokenErrorKind.MALFORMED);
    }

    @Test
    void decodeAccess_ShouldBeMalformed_WhenIssuerDiffers() {
        String token = codec.encodeAccess(access(T0, 900), accessKey);

        assertKind(() -> codec.decodeAccess(token, accessKey, "someone-else"), TokenErrorKind.MALFORMED);
    }

    @Test
    void decodeAccess_ShouldRejectRefreshToken() {
        String refresh = codec.encodeRefresh(new RefreshClaims("u1", "r1", TokenFixtures.ISSUER, T0, T0.plusSeconds(604800)), refreshKey);

        // 密钥不同，验签就过不去
        assertKind(() -> codec.decodeAccess(refresh, accessKey, TokenFixtures.ISSUER), TokenErrorKind.SIGNATURE_INVALID);
        // 即便用同一把密钥，typ 也对不上
        assertKind(() -> codec.decodeAccess(refresh, refreshKey, TokenFixtures.ISSUER), TokenErrorKind.MALFORMED);
    }

    @Test
    void decodeRefresh_ShouldCarryOnlySubjectAndId() {
        RefreshClaims claims = new RefreshClaims("u1", "r1", TokenFixtures.ISSUER, T0, T0.plusSeconds(604800));
        String token = codec.encodeRefresh(claims, refreshKey);

        assertThat(codec.decodeRefresh(token, refreshKey, TokenFixtures.ISSUER)).isEqualTo(claims);
    }

    private static AccessClaims access(Instant iat, long ttlSeconds) {
        return new AccessClaims("u1", "u1@example.com", "alice", "user", "jti-1", TokenFixtures.ISSUER,
                iat, iat.plusSeconds(ttlSeconds));
    }

    private static String b64(String json) {
        return Encoders.BASE64URL.encode(json.getBytes(StandardCharsets.UTF_8));
    }

    private static void assertKind(Runnable call, TokenErrorKind kind) {
        assertThatThrownBy(call::run)
                .isInstanceOf(TokenException.class)
                .satisfies(e -> assertThat(((TokenException) e).kind()).isEqualTo(kind));
    }
}
