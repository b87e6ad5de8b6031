package com.seatview.mapper.camera;

/**
 * Field-of-view tuning for the coordinate mapper.
 *
 * <p>The fov falls linearly from {@code maxFov} at {@code nearDistance} to {@code minFov} at
 * {@code farDistance} and is clamped outside that band.
 *
 * @param minFov narrowest fov in degrees, used for far seats
 * @param maxFov widest fov in degrees, used for close seats
 * @param nearDistance distance in meters at or below which {@code maxFov} applies
 * @param farDistance distance in meters at or above which {@code minFov} applies
 */
public record MapperSettings(double minFov, double maxFov, double nearDistance, double farDistance) {
  public static final MapperSettings DEFAULTS = new MapperSettings(40.0, 75.0, 15.0, 120.0);

  public MapperSettings {
    if (!(minFov > 0) || minFov > maxFov || maxFov >= 180.0) {
      throw new IllegalArgumentException("fov range must satisfy 0 < min <= max < 180");
    }
    if (nearDistance < 0 || farDistance < nearDistance) {
      throw new IllegalArgumentException("fov distances must satisfy 0 <= near <= far");
    }
  }

  /** Field of view for a seat at the given distance from field center. */
  public double fovFor(double distance) {
    if (farDistance == nearDistance) {
      return distance <= nearDistance ? maxFov : minFov;
    }
    double t = Math.max(0.0, Math.min(1.0, (distance - nearDistance) / (farDistance - nearDistance)));
    double fov = maxFov + t * (minFov - maxFov);
    return Math.max(minFov, Math.min(maxFov, fov));
  }
}
