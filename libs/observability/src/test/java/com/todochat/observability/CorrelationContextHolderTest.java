package com.todochat.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("outside a request")
    class OutsideRequest {

        @Test
        @DisplayName("there is no context or correlation id")
        void nothingBound() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isEmpty();
        }

        @Test
        @DisplayName("binding a user is ignored")
        void bindUserIgnored() {
            CorrelationContextHolder.bindUser("42");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("userId")).isNull();
        }

        @Test
        @DisplayName("a null context is refused")
        void nullRefused() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }
    }

    @Nested
    @DisplayName("during a request")
    class DuringRequest {

        @Test
        @DisplayName("the context and its MDC entries are visible on the serving thread")
        void contextVisible() {
            var ctx = new CorrelationContext("req-7f3a", null, "198.51.100.4");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(CorrelationContextHolder.currentCorrelationId()).contains("req-7f3a");
            assertThat(MDC.get("correlationId")).isEqualTo("req-7f3a");
            assertThat(MDC.get("clientAddress")).isEqualTo("198.51.100.4");
            assertThat(MDC.get("userId")).isNull();
        }

        @Test
        @DisplayName("authentication adds the user without losing the rest")
        void bindUserKeepsCorrelation() {
            CorrelationContextHolder.set(new CorrelationContext("req-7f3a", null, "198.51.100.4"));

            CorrelationContextHolder.bindUser("42");

            assertThat(CorrelationContextHolder.get()).hasValue(
                    new CorrelationContext("req-7f3a", "42", "198.51.100.4"));
            assertThat(MDC.get("userId")).isEqualTo("42");
        }

        @Test
        @DisplayName("replacing the context drops MDC values the new one lacks")
        void replaceDropsStaleMdc() {
            CorrelationContextHolder.set(new CorrelationContext("req-1", "42", "198.51.100.4"));
            CorrelationContextHolder.set(CorrelationContext.of("req-2"));

            assertThat(MDC.get("correlationId")).isEqualTo("req-2");
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("clientAddress")).isNull();
        }

        @Test
        @DisplayName("other threads do not see it")
        void threadConfined() {
            CorrelationContextHolder.set(CorrelationContext.of("req-main"));

            var seenElsewhere = CompletableFuture
                    .supplyAsync(CorrelationContextHolder::currentCorrelationId)
                    .join();

            assertThat(seenElsewhere).isEmpty();
        }
    }

    @Test
    @DisplayName("clearing removes the context and every MDC key")
    void clearRemovesEverything() {
        CorrelationContextHolder.set(new CorrelationContext("req-1", "42", "198.51.100.4"));

        CorrelationContextHolder.clear();

        assertThat(CorrelationContextHolder.get()).isEmpty();
        CorrelationContext.MDC_KEYS.forEach(key -> assertThat(MDC.get(key)).as(key).isNull());
    }
}
