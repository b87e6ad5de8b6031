package com.seatview.mapper.geometry;

/**
 * Explicit front and back edges of a section, used instead of the field-facing bounding-box axis
 * when a section's rows run at an angle to the seatmap axes.
 *
 * @param frontStart first point of the front-row edge
 * @param frontEnd second point of the front-row edge
 * @param backStart first point of the back-row edge
 * @param backEnd second point of the back-row edge
 */
public record DepthAxis(Point2D frontStart, Point2D frontEnd, Point2D backStart, Point2D backEnd) {

  public Point2D frontMid() {
    return new Point2D((frontStart.x() + frontEnd.x()) / 2.0, (frontStart.y() + frontEnd.y()) / 2.0);
  }

  public Point2D backMid() {
    return new Point2D((backStart.x() + backEnd.x()) / 2.0, (backStart.y() + backEnd.y()) / 2.0);
  }

  /** Length of the axis between the two edge midpoints. */
  public double length() {
    return frontMid().distanceTo(backMid());
  }
}
