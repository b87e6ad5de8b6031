package com.seatview.viewer.api;

/** Unknown venue or resource. Mapped to HTTP 404 by {@link ApiExceptionHandler}. */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
