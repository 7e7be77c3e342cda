package com.todochat.chatapi.config;

import com.todochat.security.TokenSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token settings, bound from {@code todochat.security.*}.
 *
 * <p>The signing secret must come from the environment ({@code TODOCHAT_SECURITY_SIGNING_SECRET})
 * and be long enough for the algorithm; a short secret fails start-up in {@link #tokenSettings()}.
 *
 * @param signingSecret      HMAC key material. Required.
 * @param signingAlgorithm   HS256 (default), HS384 or HS512
 * @param tokenLifetimeHours token validity; 0 means the default of 24
 */
@ConfigurationProperties(prefix = "todochat.security")
@Validated
public record SecurityProperties(
        @NotBlank String signingSecret,
        String signingAlgorithm,
        @PositiveOrZero int tokenLifetimeHours) {

    public SecurityProperties {
        if (signingAlgorithm == null || signingAlgorithm.isBlank()) {
            signingAlgorithm = TokenSettings.DEFAULT_ALGORITHM;
        }
        if (tokenLifetimeHours == 0) {
            tokenLifetimeHours = (int) TokenSettings.DEFAULT_LIFETIME.toHours();
        }
    }

    public TokenSettings tokenSettings() {
        return new TokenSettings(signingSecret, signingAlgorithm, Duration.ofHours(tokenLifetimeHours));
    }

    @Override
    public String toString() {
        return "SecurityProperties[signingSecret=****, signingAlgorithm=" + signingAlgorithm
                + ", tokenLifetimeHours=" + tokenLifetimeHours + "]";
    }
}
