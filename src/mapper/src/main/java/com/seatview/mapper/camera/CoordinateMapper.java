package com.seatview.mapper.camera;

import com.seatview.mapper.geometry.GeometryEngine;
import com.seatview.mapper.geometry.NearestSection;
import com.seatview.mapper.geometry.Point2D;
import com.seatview.mapper.geometry.Point3D;
import com.seatview.mapper.venue.InvalidVenueConfigException;
import com.seatview.mapper.venue.Section;
import com.seatview.mapper.venue.SectionIds;
import com.seatview.mapper.venue.Tier;
import com.seatview.mapper.venue.VenueModel;
import java.util.List;

/**
 * Maps a normalized seatmap click to a camera pose.
 *
 * <p>Resolution steps:
 * <ul>
 *   <li>find the section polygon containing the click (lowest id when several do)</li>
 *   <li>otherwise fall back to the section with the closest centroid</li>
 *   <li>interpolate the seat distance inside the tier's range from the click depth</li>
 *   <li>place the camera in cylindrical coordinates around field center</li>
 * </ul>
 *
 * <p>The mapper holds no mutable state and performs no I/O, so one instance can serve every
 * request concurrently. Out-of-bounds and overlapping clicks are reported through
 * {@link MappingResult#resolution()}, never as errors.
 */
public class CoordinateMapper {
  private final MapperSettings settings;

  public CoordinateMapper() {
    this(MapperSettings.DEFAULTS);
  }

  public CoordinateMapper(MapperSettings settings) {
    this.settings = settings;
  }

  /**
   * Computes the camera pose for a click.
   *
   * @param click normalized click
   * @param venue validated venue
   * @return pose and resolution details
   * @throws SectionResolutionException when the venue has no sections
   */
  public MappingResult map(ClickPoint click, VenueModel venue) {
    List<Section> sections = venue.sections();
    if (sections.isEmpty()) {
      throw new SectionResolutionException(venue.id());
    }

    Point2D point = click.toPoint();
    Section section = null;
    int hits = 0;
    for (Section candidate : sections) {
      if (GeometryEngine.pointInPolygon(point, candidate.polygon())) {
        hits++;
        if (section == null || SectionIds.ORDER.compare(candidate.id(), section.id()) < 0) {
          section = candidate;
        }
      }
    }

    SectionResolution resolution;
    double fallbackDistance = 0.0;
    if (hits == 0) {
      NearestSection nearest = GeometryEngine.nearestSection(point, sections);
      section = venue.section(nearest.sectionId()).orElseThrow();
      resolution = SectionResolution.NEAREST_FALLBACK;
      fallbackDistance = nearest.distance();
    } else {
      resolution = hits == 1 ? SectionResolution.CONTAINED : SectionResolution.OVERLAPPING;
    }

    int tierId = section.tierId();
    Tier tier = venue.tier(tierId).orElseThrow(() -> new InvalidVenueConfigException(
        "venue " + venue.id() + ": section references unknown tier " + tierId));

    double depth = GeometryEngine.interpolateDepth(point, section.polygon(), section.depthAxis());
    if (section.rowCount() != null && section.rowCount() > 0) {
      depth = snapToRow(depth, section.rowCount());
    }
    double lateral = GeometryEngine.interpolateLateral(point, section.polygon(), section.depthAxis());

    double distance = tier.distanceAt(depth);
    double angleDegrees = section.angle() + (lateral - 0.5) * venue.type().lateralSpreadDegrees();
    double angle = Math.toRadians(angleDegrees);
    double sin = Math.sin(angle);
    double cos = Math.cos(angle);

    Point3D center = venue.fieldCenter();
    Point3D position = new Point3D(
        center.x() + distance * sin,
        center.y() - distance * cos,
        center.z() + tier.elevation());

    // Lead never reaches past the halfway point to the seat.
    double lead = Math.min(venue.type().targetLeadMeters(), distance / 2.0);
    Point3D target = new Point3D(center.x() + lead * sin, center.y() - lead * cos, center.z());

    CameraPose pose = new CameraPose(
        venue.id(),
        section.id(),
        position,
        target,
        CameraRotation.lookingAt(position, target),
        settings.fovFor(distance));
    return new MappingResult(pose, resolution, depth, lateral, distance, angleDegrees, fallbackDistance);
  }

  /** Shortcut for {@link #map(ClickPoint, VenueModel)} when only the pose is needed. */
  public CameraPose pose(ClickPoint click, VenueModel venue) {
    return map(click, venue).pose();
  }

  public MapperSettings settings() {
    return settings;
  }

  static double snapToRow(double depth, int rowCount) {
    int row = Math.min(rowCount - 1, (int) Math.floor(depth * rowCount));
    return (row + 0.5) / rowCount;
  }
}
