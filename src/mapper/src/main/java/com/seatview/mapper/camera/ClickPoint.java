package com.seatview.mapper.camera;

import com.seatview.mapper.geometry.Point2D;

/**
 * A click on the seatmap in normalized coordinates.
 *
 * @param x horizontal position in {@code [0, 1]}
 * @param y vertical position in {@code [0, 1]}, growing downward
 */
public record ClickPoint(double x, double y) {

  public ClickPoint {
    if (!inUnitRange(x) || !inUnitRange(y)) {
      throw new IllegalArgumentException("click must be within [0,1]x[0,1], got (" + x + ", " + y + ")");
    }
  }

  /**
   * Normalizes a pixel click against the seatmap image size.
   *
   * @param px pixel column
   * @param py pixel row
   * @param width image width in pixels
   * @param height image height in pixels
   * @return normalized click
   */
  public static ClickPoint fromPixels(double px, double py, int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("seatmap dimensions must be positive");
    }
    return new ClickPoint(px / width, py / height);
  }

  public Point2D toPoint() {
    return new Point2D(x, y);
  }

  private static boolean inUnitRange(double value) {
    return value >= 0.0 && value <= 1.0;
  }
}
