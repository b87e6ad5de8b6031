package com.seatview.mapper.venue;

import com.seatview.mapper.geometry.DepthAxis;
import com.seatview.mapper.geometry.Point2D;
import java.util.List;
import java.util.Objects;

/**
 * Polygonal block of seats on the seatmap.
 *
 * @param id section identifier, unique within a venue
 * @param tierId owning tier number
 * @param polygon vertices in normalized coordinates, implicitly closed
 * @param angle position around field center in degrees (0 = behind home plate / center ice)
 * @param rowCount number of rows, or {@code null} when clicks are not snapped to rows
 * @param depthAxis explicit front/back edges, or {@code null} to use the bounding box
 */
public record Section(
    String id,
    int tierId,
    List<Point2D> polygon,
    double angle,
    Integer rowCount,
    DepthAxis depthAxis) {

  public Section {
    Objects.requireNonNull(id, "id");
    polygon = List.copyOf(Objects.requireNonNull(polygon, "polygon"));
  }

  public Section(String id, int tierId, List<Point2D> polygon, double angle) {
    this(id, tierId, polygon, angle, null, null);
  }
}
