package com.todochat.chatapi.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Principals known to this service, bound from {@code todochat.directory.*}.
 *
 * <pre>
 * todochat:
 *   directory:
 *     principals:
 *       - id: "42"
 *         display-name: Ada
 * </pre>
 */
@ConfigurationProperties(prefix = "todochat.directory")
@Validated
public record DirectoryProperties(@Valid List<Principal> principals) {

    public DirectoryProperties {
        principals = principals == null ? List.of() : List.copyOf(principals);
    }

    /**
     * @param id          principal id, as carried in token subjects
     * @param displayName optional display name
     */
    public record Principal(@NotBlank String id, String displayName) {
    }
}
