package com.seatview.mapper.venue;

/**
 * Raised when a venue configuration is structurally malformed.
 *
 * <p>Thrown at load time only; a venue that fails validation is never published to the mapping
 * path.
 */
public class InvalidVenueConfigException extends RuntimeException {

  public InvalidVenueConfigException(String message) {
    super(message);
  }

  public InvalidVenueConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
