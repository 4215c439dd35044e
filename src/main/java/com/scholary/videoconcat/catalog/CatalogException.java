package com.scholary.videoconcat.catalog;

/**
 * Base class for failures while loading a video catalog.
 *
 * <p>These are fatal for a planning run: nothing can be planned without a usable catalog, so they
 * are unchecked and propagate up to the API layer.
 */
public abstract class CatalogException extends RuntimeException {

  protected CatalogException(String message) {
    super(message);
  }

  protected CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
