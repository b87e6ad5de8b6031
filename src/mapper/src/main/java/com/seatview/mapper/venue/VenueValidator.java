package com.seatview.mapper.venue;

import com.seatview.mapper.geometry.GeometryEngine;
import com.seatview.mapper.geometry.Point2D;
import java.util.HashSet;
import java.util.Set;

/**
 * Load-time structural checks for {@link VenueModel}.
 *
 * <p>The mapping path assumes a validated venue and does not repeat these checks.
 */
public final class VenueValidator {
  private static final double MIN_POLYGON_AREA = 1e-9;

  private VenueValidator() {}

  /**
   * Validates a venue and returns it unchanged.
   *
   * @param venue venue to check
   * @return the same venue
   * @throws InvalidVenueConfigException on the first violation found
   */
  public static VenueModel validate(VenueModel venue) {
    String prefix = "venue " + venue.id() + ": ";
    if (venue.id().isBlank()) {
      throw new InvalidVenueConfigException("venue id is blank");
    }
    if (venue.templateId() == null || venue.templateId().isBlank()) {
      throw new InvalidVenueConfigException(prefix + "template is missing");
    }
    if (venue.seatmap() != null && (venue.seatmap().width() <= 0 || venue.seatmap().height() <= 0)) {
      throw new InvalidVenueConfigException(prefix + "seatmap dimensions must be positive");
    }
    if (venue.sections().isEmpty()) {
      throw new InvalidVenueConfigException(prefix + "no sections declared");
    }

    Set<Integer> tierIds = new HashSet<>();
    for (Tier tier : venue.tiers()) {
      if (!tierIds.add(tier.id())) {
        throw new InvalidVenueConfigException(prefix + "duplicate tier " + tier.id());
      }
      if (!(tier.minDistance() > 0) || !(tier.maxDistance() > 0) || tier.minDistance() > tier.maxDistance()) {
        throw new InvalidVenueConfigException(
            prefix + "tier " + tier.id() + " distance range must satisfy 0 < min <= max");
      }
      if (!Double.isFinite(tier.elevation())) {
        throw new InvalidVenueConfigException(prefix + "tier " + tier.id() + " elevation is not finite");
      }
    }

    Set<String> sectionIds = new HashSet<>();
    for (Section section : venue.sections()) {
      String where = prefix + "section " + section.id() + " ";
      if (section.id().isBlank()) {
        throw new InvalidVenueConfigException(prefix + "section with blank id");
      }
      if (!sectionIds.add(section.id())) {
        throw new InvalidVenueConfigException(prefix + "duplicate section id " + section.id());
      }
      if (!tierIds.contains(section.tierId())) {
        throw new InvalidVenueConfigException(where + "references unknown tier " + section.tierId());
      }
      if (!Double.isFinite(section.angle())) {
        throw new InvalidVenueConfigException(where + "angle is not finite");
      }
      if (section.rowCount() != null && section.rowCount() <= 0) {
        throw new InvalidVenueConfigException(where + "row count must be positive");
      }
      validatePolygon(where, section);
    }
    return venue;
  }

  private static void validatePolygon(String where, Section section) {
    if (section.polygon().size() < 3) {
      throw new InvalidVenueConfigException(where + "polygon needs at least 3 vertices");
    }
    for (Point2D vertex : section.polygon()) {
      if (!inUnitSquare(vertex)) {
        throw new InvalidVenueConfigException(where + "vertex " + vertex + " is outside [0,1]x[0,1]");
      }
    }
    if (Math.abs(GeometryEngine.signedArea(section.polygon())) < MIN_POLYGON_AREA) {
      throw new InvalidVenueConfigException(where + "polygon is degenerate");
    }
    if (!GeometryEngine.isSimple(section.polygon())) {
      throw new InvalidVenueConfigException(where + "polygon is self-intersecting");
    }
  }

  private static boolean inUnitSquare(Point2D point) {
    return point.x() >= 0.0 && point.x() <= 1.0 && point.y() >= 0.0 && point.y() <= 1.0;
  }
}
