package com.scholary.videoconcat.config;

import com.scholary.videoconcat.planning.ReuseMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default planner settings ("planner.*" in application.yml).
 *
 * <p>Every value can be overridden per request. Cross-field checks (min vs. max) are left to
 * {@code PlanningConfig}, which sees the merged values.
 */
@ConfigurationProperties(prefix = "planner")
@Validated
public record PlannerProperties(
    @PositiveOrZero int totalConcats,
    @Positive int minVideosPerConcat,
    @Positive int maxVideosPerConcat,
    @PositiveOrZero double targetDurationMin,
    @Positive double targetDurationMax,
    boolean allowReuse,
    @NotNull ReuseMode reuseMode,
    double maxUsageRatio,
    long seed,
    @Positive int maxAttemptsPerRecord,
    @PositiveOrZero double relaxThresholdRatio,
    @Positive int progressLogInterval) {}
