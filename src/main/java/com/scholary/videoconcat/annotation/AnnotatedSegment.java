package com.scholary.videoconcat.annotation;

/** One clip of a concatenated video with its description. Times are seconds from the start. */
public record AnnotatedSegment(double start, double end, String summary) {}
