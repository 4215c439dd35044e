package com.scholary.videoconcat.api;

import com.scholary.videoconcat.planning.PlanStatistics;
import com.scholary.videoconcat.planning.PlanningConfig;
import com.scholary.videoconcat.service.ConcatMetadataEntry;
import java.util.List;
import java.util.Map;

/**
 * Response for a completed planning run.
 *
 * <p>Records use the same shape as the saved {@code concat_metadata.json}. {@code storageInfo} is
 * null when the plan was not saved.
 */
public record PlanResponse(
    PlanningConfig config,
    List<ConcatMetadataEntry> records,
    PlanStatistics statistics,
    Map<String, Integer> usage,
    StorageInfo storageInfo) {}
