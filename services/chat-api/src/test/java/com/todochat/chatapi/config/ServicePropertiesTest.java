package com.todochat.chatapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceProperties")
class ServicePropertiesTest {

    @Test
    @DisplayName("defaults environment to 'development' when blank")
    void defaultsEnvironment() {
        assertThat(new ServiceProperties("chat-api", null).environment()).isEqualTo("development");
        assertThat(new ServiceProperties("chat-api", " ").environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("keeps a configured environment")
    void keepsEnvironment() {
        assertThat(new ServiceProperties("chat-api", "production").environment()).isEqualTo("production");
    }
}
