package com.seatview.mapper.venue;

import java.util.Locale;

/**
 * Closed set of supported venue types.
 *
 * <p>Each type carries the camera heuristics used by the coordinate mapper, so the per-sport
 * tuning lives in one place instead of inline literals.
 */
public enum VenueType {
  BASEBALL(6.0, 8.0),
  FOOTBALL(5.0, 6.0),
  HOCKEY(4.0, 2.0),
  BASKETBALL(4.0, 1.5);

  private final double lateralSpreadDegrees;
  private final double targetLeadMeters;

  VenueType(double lateralSpreadDegrees, double targetLeadMeters) {
    this.lateralSpreadDegrees = lateralSpreadDegrees;
    this.targetLeadMeters = targetLeadMeters;
  }

  /** Total angular spread applied across the width of a section, in degrees. */
  public double lateralSpreadDegrees() {
    return lateralSpreadDegrees;
  }

  /** Distance the look-at target is moved from field center toward the seat, in meters. */
  public double targetLeadMeters() {
    return targetLeadMeters;
  }

  /**
   * Parses a configuration value such as {@code baseball}.
   *
   * @param raw value from a venue file
   * @return matching type
   * @throws InvalidVenueConfigException when the value is blank or unknown
   */
  public static VenueType fromConfig(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidVenueConfigException("venue type is missing");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (VenueType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    throw new InvalidVenueConfigException("unknown venue type: " + raw.trim());
  }

  public String configValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
