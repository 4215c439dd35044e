package com.scholary.videoconcat.annotation;

import java.util.List;

/**
 * Training example for one concatenated video.
 *
 * @param video the concatenated video name, {@code .mp4} included
 * @param images frame paths in the order their {@code <image>} turns appear
 * @param conversations the streamed turns
 */
public record TrainConversation(
    String video, List<String> images, List<ConversationTurn> conversations) {

  public TrainConversation {
    images = List.copyOf(images);
    conversations = List.copyOf(conversations);
  }
}
