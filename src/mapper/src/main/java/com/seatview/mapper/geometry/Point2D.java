package com.seatview.mapper.geometry;

/**
 * Point in normalized seatmap space, where both axes span {@code [0, 1]}.
 *
 * <p>The y axis grows downward, as on the seatmap image.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Point2D(double x, double y) {

  public static Point2D of(double x, double y) {
    return new Point2D(x, y);
  }

  public double distanceTo(Point2D other) {
    double dx = x - other.x;
    double dy = y - other.y;
    return Math.sqrt(dx * dx + dy * dy);
  }
}
