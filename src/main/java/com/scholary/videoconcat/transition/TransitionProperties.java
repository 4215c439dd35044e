package com.scholary.videoconcat.transition;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transition text API ("transition.*" in application.yml).
 *
 * <p>{@code baseUrl} and {@code model} are only required when {@code enabled} is true. Timeouts
 * are in seconds.
 */
@ConfigurationProperties(prefix = "transition")
@Validated
public record TransitionProperties(
    boolean enabled,
    String baseUrl,
    String model,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
