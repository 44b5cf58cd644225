package com.quorum.books.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code quorum.service.*}.
 *
 * <pre>
 * quorum:
 *   service:
 *     name: books-service
 *     environment: production
 * </pre>
 *
 * @param name service name used in log lines. Required.
 * @param environment deployment environment, {@code development} when unset
 */
@ConfigurationProperties(prefix = "quorum.service")
@Validated
public record BooksServiceProperties(@NotBlank String name, String environment) {

    public BooksServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
