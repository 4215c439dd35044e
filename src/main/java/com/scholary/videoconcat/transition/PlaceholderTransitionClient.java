package com.scholary.videoconcat.transition;

/**
 * Offline stand-in used when transition generation is disabled.
 *
 * <p>Keeps the clip's own description and marks it so generated data can be told apart from
 * placeholder data later.
 */
public class PlaceholderTransitionClient implements TransitionClient {

  static final String MARKER = "[TRANSITION] ";

  @Override
  public String generateTransition(String previousDescription, String currentDescription) {
    return MARKER + currentDescription;
  }
}
