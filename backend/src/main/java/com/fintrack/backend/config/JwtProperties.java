package com.fintrack.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Signing material and lifetimes for access and refresh tokens.
 * <p>
 * {@code refreshSecret} is optional; when blank, refresh tokens are signed with
 * {@code secret} as well.
 */
@Configuration
@ConfigurationProperties(prefix = "fintrack.jwt")
@Data
public class JwtProperties {

    private String secret;
    private String refreshSecret;
    private Duration accessTokenTtl = Duration.ofMinutes(15);
    private Duration refreshTokenTtl = Duration.ofDays(7);

    public boolean hasDedicatedRefreshSecret() {
        return refreshSecret != null && !refreshSecret.isBlank();
    }
}
