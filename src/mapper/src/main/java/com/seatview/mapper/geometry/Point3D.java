package com.seatview.mapper.geometry;

/**
 * Point in venue space, in meters. The field plane is {@code z = 0}.
 *
 * @param x east-west axis
 * @param y north-south axis
 * @param z elevation
 */
public record Point3D(double x, double y, double z) {
  public static final Point3D ORIGIN = new Point3D(0.0, 0.0, 0.0);

  public static Point3D of(double x, double y, double z) {
    return new Point3D(x, y, z);
  }
}
