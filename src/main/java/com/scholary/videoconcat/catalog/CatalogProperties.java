package com.scholary.videoconcat.catalog;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for catalog loading.
 *
 * <p>Clips shorter than {@code minDurationSeconds} are skipped at load time. Very short clips tend
 * to be probing artifacts rather than usable footage.
 */
@ConfigurationProperties(prefix = "catalog")
@Validated
public record CatalogProperties(
    @PositiveOrZero double minDurationSeconds, @Valid CacheProperties cache) {

  public record CacheProperties(@Positive int maxSize, @Positive int ttlMinutes) {}
}
