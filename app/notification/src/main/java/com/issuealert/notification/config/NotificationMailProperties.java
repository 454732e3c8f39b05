/*
 * Where: Notification application configuration binding
 * What: Holds mail subject prefix, link base url, link signing key and recipient cache TTL
 * Why: Keep message building and recipient caching tunable per environment
 */
package com.issuealert.notification.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.mail")
@Validated
public record NotificationMailProperties(
    String subjectPrefix,
    @NotBlank String baseUrl,
    @NotBlank String linkSigningKey,
    @NotNull Duration sendableCacheTtl) {}
