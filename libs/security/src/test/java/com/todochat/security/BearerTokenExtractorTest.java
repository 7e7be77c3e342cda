package com.todochat.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Test
    @DisplayName("returns the compact JWT after the scheme")
    void returnsCompactJwt() {
        assertThat(BearerTokenExtractor.extract("Bearer eyJhbGciOiJIUzI1NiJ9.payload.sig"))
                .contains("eyJhbGciOiJIUzI1NiJ9.payload.sig");
    }

    @ParameterizedTest(name = "[{index}] \"{0}\"")
    @ValueSource(strings = {"bearer tok-1", "BEARER tok-1", "  Bearer   tok-1  ", "Bearer\ttok-1"})
    @DisplayName("accepts any scheme casing and surrounding whitespace")
    void lenientAboutCaseAndWhitespace(String header) {
        assertThat(BearerTokenExtractor.extract(header)).contains("tok-1");
    }

    @Test
    @DisplayName("a missing header yields nothing")
    void nullHeader() {
        assertThat(BearerTokenExtractor.extract(null)).isEmpty();
    }

    @ParameterizedTest(name = "[{index}] \"{0}\"")
    @ValueSource(strings = {"", "   ", "Bearer", "Bearer ", "Basic dXNlcjpwYXNz", "Bearerabc.def.ghi",
            "Bearer abc def", "Token abc"})
    @DisplayName("anything but a single bearer token yields nothing")
    void rejectsMalformed(String header) {
        assertThat(BearerTokenExtractor.extract(header)).isEmpty();
    }
}
