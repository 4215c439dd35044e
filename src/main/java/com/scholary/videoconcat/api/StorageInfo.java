package com.scholary.videoconcat.api;

/**
 * Where a saved document landed, with a presigned link for downloading it.
 */
public record StorageInfo(String bucket, String key, String url) {}
