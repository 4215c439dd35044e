package com.scholary.videoconcat.transition;

/**
 * Generates the description of a clip in a concatenated video, bridging from the clip before it.
 */
public interface TransitionClient {

  /**
   * Generate transition text.
   *
   * @param previousDescription description of the preceding clip
   * @param currentDescription description of the clip being described
   * @return text that describes the current clip and briefly refers back to the previous one
   * @throws TransitionException if generation fails
   */
  String generateTransition(String previousDescription, String currentDescription);
}
