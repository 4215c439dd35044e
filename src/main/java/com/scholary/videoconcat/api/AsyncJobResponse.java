package com.scholary.videoconcat.api;

/**
 * Response for an async planning request.
 *
 * <p>Returns a job ID that can be polled at {@code /api/jobs/{id}}.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
