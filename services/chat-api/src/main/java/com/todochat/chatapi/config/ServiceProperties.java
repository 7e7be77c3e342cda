package com.todochat.chatapi.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code todochat.service.*}.
 *
 * <pre>
 * todochat:
 *   service:
 *     name: chat-api
 *     environment: production
 * </pre>
 *
 * @param name        service name used as the {@code service} metric tag. Required.
 * @param environment deployment environment; {@code development} exposes exception detail in 500
 *                    responses, anything else hides it
 */
@ConfigurationProperties(prefix = "todochat.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    public static final String DEVELOPMENT = "development";

    /** Applies defaults before Bean Validation runs. */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = DEVELOPMENT;
        }
    }
}
