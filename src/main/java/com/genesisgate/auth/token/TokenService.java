package com.genesisgate.auth.token;

import com.genesisgate.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * accessToken / refreshToken 的签发与生命周期。
 *
 * <ul>
 *   <li>accessToken：短有效期（默认 15 分钟），携带完整身份，校验纯本地，不访问 Redis</li>
 *   <li>refreshToken：长有效期（默认 7 天），只携带 userId；每次使用都会轮换，旧 token 立即作废</li>
 * </ul>
 *
 * <p>台账（Redis）不可用时一律 fail-closed：宁可让客户端重试，也不签发没有台账记录的 token。</p>
 */
@Slf4j
@Service
public class TokenService {

    public static final String TOKEN_TYPE = "bearer";

    private final AuthProperties props;
    private final JwtCodec codec;
    private final TokenHasher tokenHasher;
    private final RefreshTokenLedger ledger;
    private final Clock clock;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public TokenService(AuthProperties props,
                        JwtCodec codec,
                        TokenHasher tokenHasher,
                        RefreshTokenLedger ledger,
                        Clock clock) {
        this.props = props;
        this.codec = codec;
        this.tokenHasher = tokenHasher;
        this.ledger = ledger;
        this.clock = clock;
        this.accessKey = JwtCodec.hmacKey(props.accessTokenSecret());
        this.refreshKey = JwtCodec.hmacKey(props.refreshTokenSecret());
    }

    /**
     * 登录成功后调用：签发一对新 token，并开启一个新的会话（sessionId）。
     */
    public TokenPair issuePair(String userId, String email, String username, String role, RequestMetadata metadata) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId_required");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role_required");
        }
        Identity identity = new Identity(userId, email == null ? "" : email, username == null ? "" : username, role);
        TokenPair pair = issuePair(identity, UUID.randomUUID().toString(), metadata);
        log.info("token pair issued: userId={}", userId);
        return pair;
    }

    public Identity validateAccess(String accessToken) {
        return codec.decodeAccess(accessToken, accessKey, props.issuer()).toIdentity();
    }

    /**
     * 用 refreshToken 换发新的一对 token（轮换）。
     *
     * <ol>
     *   <li>验签 + 过期检查（refresh 密钥）</li>
     *   <li>读台账：找不到为 UNKNOWN，已撤销为 REVOKED</li>
     *   <li>先在同一会话里写入新记录，再原子地把旧记录标记为 ROTATED</li>
     * </ol>
     *
     * <p>新记录写失败时旧 token 原样保留，客户端重试即可。旧记录没能作废（并发轮换或台账故障）时，
     * 刚写入的新记录按 DISCARDED 撤销，不会下发。</p>
     *
     * <p>已经因轮换作废的 token 再次出现，说明 token 可能泄露：把该会话当前有效的 token 也撤销掉。</p>
     */
    public TokenPair refresh(String refreshToken, RequestMetadata metadata) {
        RefreshClaims claims = codec.decodeRefresh(refreshToken, refreshKey, props.issuer());
        String tokenHash = tokenHasher.sha256Hex(refreshToken);
        Instant now = clock.instant();

        RefreshRecord current = withLedger("find", () -> ledger.find(tokenHash))
                .orElseThrow(() -> new TokenException(TokenErrorKind.UNKNOWN, "refresh_token_unknown"));
        if (current.revoked()) {
            onReplay(current, now);
            throw new TokenException(TokenErrorKind.REVOKED, "refresh_token_revoked");
        }
        if (!claims.userId().equals(current.userId())) {
            log.warn("refresh ledger subject mismatch: recordId={}", current.recordId());
            throw new TokenException(TokenErrorKind.UNKNOWN, "refresh_token_unknown");
        }

        TokenPair pair = issuePair(current.identity(), current.sessionId(), metadata);
        String successorHash = tokenHasher.sha256Hex(pair.refreshToken());

        RefreshTokenLedger.RevokeResult result;
        try {
            result = ledger.revoke(tokenHash, RevokeReason.ROTATED, now);
        } catch (DataAccessException e) {
            discard(successorHash, now);
            log.warn("refresh ledger unavailable: op=consume, err={}", e.toString());
            throw new TokenException(TokenErrorKind.DEPENDENCY_UNAVAILABLE, "ledger_unavailable", e);
        }

        if (result.outcome() != RefreshTokenLedger.Outcome.REVOKED_NOW) {
            // 并发请求抢先轮换或撤销了旧记录
            discard(successorHash, now);
            if (result.outcome() == RefreshTokenLedger.Outcome.NOT_FOUND) {
                throw new TokenException(TokenErrorKind.UNKNOWN, "refresh_token_unknown");
            }
            throw new TokenException(TokenErrorKind.REVOKED, "refresh_token_revoked");
        }

        log.info("refresh token rotated: userId={}, sessionId={}", current.userId(), current.sessionId());
        return pair;
    }

    /**
     * 登出：撤销服务端记录。token 不存在或已撤销时返回 false（不报错）。
     */
    public boolean revoke(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return false;
        }
        String tokenHash = tokenHasher.sha256Hex(refreshToken);
        RefreshTokenLedger.RevokeResult result =
                withLedger("revoke", () -> ledger.revoke(tokenHash, RevokeReason.LOGOUT, clock.instant()));
        return result.outcome() == RefreshTokenLedger.Outcome.REVOKED_NOW;
    }

    public int revokeAll(String userId, RevokeReason reason) {
        int n = withLedger("revokeAll", () -> ledger.revokeAllForUser(userId, reason, clock.instant()));
        log.info("refresh tokens revoked: userId={}, reason={}, count={}", userId, reason, n);
        return n;
    }

    private TokenPair issuePair(Identity identity, String sessionId, RequestMetadata metadata) {
        // JWT 的 iat/exp 精度是秒，台账与之对齐
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        AccessClaims access = new AccessClaims(
                identity.userId(), identity.email(), identity.username(), identity.role(),
                UUID.randomUUID().toString(), props.issuer(),
                now, now.plusSeconds(props.accessTokenTtlSeconds()));
        RefreshClaims refresh = new RefreshClaims(
                identity.userId(), UUID.randomUUID().toString(), props.issuer(),
                now, now.plusSeconds(props.refreshTokenTtlSeconds()));

        String accessToken = codec.encodeAccess(access, accessKey);
        String refreshToken = codec.encodeRefresh(refresh, refreshKey);

        RefreshRecord record = RefreshRecord.issued(
                refresh.tokenId(), tokenHasher.sha256Hex(refreshToken), sessionId, identity,
                now, refresh.expiresAt(), metadata);
        withLedger("save", () -> {
            ledger.save(record);
            return null;
        });

        return new TokenPair(accessToken, refreshToken, props.accessTokenTtlSeconds());
    }

    private void onReplay(RefreshRecord record, Instant now) {
        if (record == null || record.revokeReason() != RevokeReason.ROTATED) {
            return;
        }
        try {
            int n = ledger.revokeSession(record.sessionId(), RevokeReason.REUSE_DETECTED, now);
            log.warn("rotated refresh token replayed, session revoked: userId={}, sessionId={}, revoked={}",
                    record.userId(), record.sessionId(), n);
        } catch (DataAccessException e) {
            log.warn("revoke replayed session failed: sessionId={}, err={}", record.sessionId(), e.toString());
        }
    }

    private void discard(String tokenHash, Instant now) {
        try {
            ledger.revoke(tokenHash, RevokeReason.DISCARDED, now);
        } catch (DataAccessException e) {
            // 记录会随 TTL 过期；对应的 token 没有下发，无人持有
            log.warn("discard successor refresh record failed: err={}", e.toString());
        }
    }

    private <T> T withLedger(String op, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.warn("refresh ledger unavailable: op={}, err={}", op, e.toString());
            throw new TokenException(TokenErrorKind.DEPENDENCY_UNAVAILABLE, "ledger_unavailable", e);
        }
    }
}
