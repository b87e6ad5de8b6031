package com.seatview.mapper.camera;

/**
 * Raised when a click cannot be attributed to any section because the venue declares none.
 *
 * <p>This points at a caller or configuration bug and is not retried.
 */
public class SectionResolutionException extends RuntimeException {
  private final String venueId;

  public SectionResolutionException(String venueId) {
    super("venue " + venueId + " has no sections");
    this.venueId = venueId;
  }

  public String getVenueId() {
    return venueId;
  }
}
