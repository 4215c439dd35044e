package com.scholary.videoconcat.transition;

/**
 * Exception thrown when transition text cannot be generated.
 *
 * <p>Raised after retries are used up, or when the API answers with something that has no text.
 */
public class TransitionException extends RuntimeException {

  public TransitionException(String message) {
    super(message);
  }

  public TransitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
