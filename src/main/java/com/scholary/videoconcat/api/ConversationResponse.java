package com.scholary.videoconcat.api;

import com.scholary.videoconcat.annotation.TrainConversation;
import java.util.List;

/**
 * Response for a training conversation request.
 *
 * @param skipped plan entries without an annotation, for example ones dropped as incomplete
 */
public record ConversationResponse(
    List<TrainConversation> conversations, int skipped, StorageInfo storageInfo) {}
