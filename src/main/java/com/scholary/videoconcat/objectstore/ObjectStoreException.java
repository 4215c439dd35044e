package com.scholary.videoconcat.objectstore;

/**
 * Exception thrown when reading or writing planner documents in object storage fails.
 *
 * <p>Runtime because a missing catalog object or bad credentials cannot be fixed by the planner;
 * the request fails and the caller is told why.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
