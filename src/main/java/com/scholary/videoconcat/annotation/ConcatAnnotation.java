package com.scholary.videoconcat.annotation;

import java.util.List;

/**
 * Annotation of one concatenated video.
 *
 * @param video the concatenated video name without its {@code .mp4} extension
 * @param data one segment per clip, in playback order
 */
public record ConcatAnnotation(String video, List<AnnotatedSegment> data) {

  public ConcatAnnotation {
    data = List.copyOf(data);
  }
}
