package com.genesisgate.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 签发/校验 token 的配置。
 *
 * <p>两个签名密钥都必须显式配置：缺失、过短或相同都会让应用启动失败，绝不回退到内置默认值。</p>
 */
@ConfigurationProperties(prefix = "gate.auth")
public record AuthProperties(
        String issuer,
        String accessTokenSecret,
        String refreshTokenSecret,
        long accessTokenTtlSeconds,
        long refreshTokenTtlSeconds,
        List<String> protectedPaths,
        List<String> publicPaths
) {

    /** HS256 要求密钥至少 256 bit。 */
    public static final int MIN_SECRET_BYTES = 32;

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("gate.auth.issuer must be configured");
        }
        requireSecret("gate.auth.access-token-secret", accessTokenSecret);
        requireSecret("gate.auth.refresh-token-secret", refreshTokenSecret);
        if (accessTokenSecret.equals(refreshTokenSecret)) {
            throw new IllegalStateException("access and refresh token secrets must differ");
        }
        if (accessTokenTtlSeconds <= 0 || refreshTokenTtlSeconds <= 0) {
            throw new IllegalStateException("token ttl must be > 0");
        }
        protectedPaths = protectedPaths == null ? List.of() : List.copyOf(protectedPaths);
        publicPaths = publicPaths == null ? List.of() : List.copyOf(publicPaths);
    }

    private static void requireSecret(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must be configured");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(name + " must be at least " + MIN_SECRET_BYTES + " bytes");
        }
    }
}
