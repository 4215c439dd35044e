package com.scholary.videoconcat.catalog;

/** Thrown when a catalog ends up with zero usable videos. */
public class EmptyCatalogException extends CatalogException {

  public EmptyCatalogException(String message) {
    super(message);
  }
}
