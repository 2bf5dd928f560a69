package com.genesisgate.auth.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class AuthPropertiesTest {

    private static final String ACCESS = "gate.auth.access-token-secret=access-secret-access-secret-access-secret-0001";
    private static final String REFRESH = "gate.auth.refresh-token-secret=refresh-secret-refresh-secret-refresh-secret-02";

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(AuthConfig.class)
            .withPropertyValues(
                    "gate.auth.issuer=genesis-music",
                    "gate.auth.access-token-ttl-seconds=900",
                    "gate.auth.refresh-token-ttl-seconds=604800");

    @Test
    void bindsWhenSecretsConfigured() {
        contextRunner
                .withPropertyValues(ACCESS, REFRESH, "gate.auth.public-paths[0]=/auth/refresh")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(Clock.class);
                    AuthProperties props = context.getBean(AuthProperties.class);
                    assertThat(props.accessTokenTtlSeconds()).isEqualTo(900);
                    assertThat(props.publicPaths()).containsExactly("/auth/refresh");
                    assertThat(props.protectedPaths()).isEmpty();
                });
    }

    @Test
    void failsWhenAccessSecretMissing() {
        contextRunner
                .withPropertyValues(REFRESH)
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsWhenSecretTooShort() {
        contextRunner
                .withPropertyValues("gate.auth.access-token-secret=short", REFRESH)
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsWhenSecretsEqual() {
        contextRunner
                .withPropertyValues(ACCESS,
                        "gate.auth.refresh-token-secret=access-secret-access-secret-access-secret-0001")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsWhenTtlNotPositive() {
        contextRunner
                .withPropertyValues(ACCESS, REFRESH, "gate.auth.access-token-ttl-seconds=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
