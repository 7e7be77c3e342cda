package com.todochat.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TokenSettings}: defaults applied by the compact constructor and
 * rejection of unusable secrets.
 */
@DisplayName("TokenSettings")
class TokenSettingsTest {

    private static final String SECRET_32 = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("defaults algorithm to HS256 and lifetime to 24 hours")
    void appliesDefaults() {
        var settings = new TokenSettings(SECRET_32, null, null);

        assertThat(settings.algorithm()).isEqualTo("HS256");
        assertThat(settings.lifetime()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    @DisplayName("requires a signing secret")
    void requiresSecret() {
        assertThatThrownBy(() -> TokenSettings.withSecret(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("signingSecret");
    }

    @Test
    @DisplayName("rejects a secret shorter than the digest size")
    void rejectsShortSecret() {
        assertThatThrownBy(() -> TokenSettings.withSecret("too-short"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "HS512", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("64 bytes");
    }

    @Test
    @DisplayName("rejects unsupported algorithms")
    void rejectsUnknownAlgorithm() {
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "RS256", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RS256");
    }

    @Test
    @DisplayName("rejects non-positive lifetimes")
    void rejectsZeroLifetime() {
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "HS256", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lifetime");
    }
}
