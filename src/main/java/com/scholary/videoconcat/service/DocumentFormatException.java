package com.scholary.videoconcat.service;

/**
 * Thrown when a stored plan or descriptions document cannot be parsed.
 */
public class DocumentFormatException extends RuntimeException {

  public DocumentFormatException(String message) {
    super(message);
  }

  public DocumentFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
