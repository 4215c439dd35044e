package com.scholary.videoconcat.catalog;

/** Thrown when catalog input is empty, unparsable, or holds a malformed entry. */
public class InvalidCatalogException extends CatalogException {

  public InvalidCatalogException(String message) {
    super(message);
  }

  public InvalidCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
