package com.todochat.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HttpResponse")
class HttpResponseTest {

    @Test
    @DisplayName("withStatus creates an empty response that stages can re-status")
    void withStatusThenRestatus() {
        HttpResponse response = HttpResponse.withStatus(204);

        assertThat(response.status()).isEqualTo(204);
        assertThat(response.body()).isNull();

        assertThat(response.status(503)).isSameAs(response);
        assertThat(response.status()).isEqualTo(503);
    }

    @Test
    @DisplayName("status codes outside 100..599 are rejected")
    void rejectsInvalidStatus() {
        assertThatThrownBy(() -> HttpResponse.withStatus(99))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HttpResponse.ok("x").status(600))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
