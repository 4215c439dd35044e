package com.scholary.videoconcat.api;

import com.scholary.videoconcat.catalog.CatalogException;
import com.scholary.videoconcat.service.DocumentFormatException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps service failures to HTTP statuses.
 *
 * <p>Bad settings are the caller's fault (400). Unusable catalogs, plans and description documents
 * are well-formed requests about bad data (422). Anything else, storage included, is a 500.
 */
final class ErrorStatus {

  private ErrorStatus() {}

  static ResponseStatusException from(Exception e) {
    if (e instanceof IllegalArgumentException) {
      return new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
    }
    if (e instanceof CatalogException || e instanceof DocumentFormatException) {
      return new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e);
    }
    return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
  }
}
