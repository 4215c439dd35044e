package com.scholary.videoconcat.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for annotating a saved plan.
 *
 * <p>{@code descriptionsKey} ending in {@code .jsonl} is read line by line, anything else as a
 * JSON array. {@code outputKey} defaults to the plan key with its extension replaced by
 * {@code _annotations.json}. With {@code dropIncomplete}, concatenations that have a clip with a
 * blank summary are left out of the result.
 */
public record AnnotationRequest(
    @NotBlank String bucket,
    @NotBlank String planKey,
    @NotBlank String descriptionsKey,
    String outputKey,
    Boolean save,
    Boolean dropIncomplete) {

  public AnnotationRequest {
    if (save == null) {
      save = true;
    }
    if (dropIncomplete == null) {
      dropIncomplete = false;
    }
  }
}
