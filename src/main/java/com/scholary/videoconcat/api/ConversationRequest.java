package com.scholary.videoconcat.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for building training conversations from a saved plan and its annotations.
 *
 * <p>{@code outputKey} defaults to the plan key with its extension replaced by
 * {@code _train_conversations.json}.
 */
public record ConversationRequest(
    @NotBlank String bucket,
    @NotBlank String planKey,
    @NotBlank String annotationsKey,
    String outputKey,
    Boolean save) {

  public ConversationRequest {
    if (save == null) {
      save = true;
    }
  }
}
