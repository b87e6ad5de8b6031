package com.seatview.mapper.camera;

import com.seatview.mapper.geometry.Point3D;

/**
 * Euler rotation in radians, in the convention of the render backend: a camera with zero
 * rotation looks straight down, {@code x = π/2} looks at the horizon.
 *
 * @param x pitch
 * @param y roll
 * @param z yaw, measured from the +y axis
 */
public record CameraRotation(double x, double y, double z) {

  /**
   * Builds the rotation of a camera at {@code position} looking at {@code target}, with no roll.
   */
  public static CameraRotation lookingAt(Point3D position, Point3D target) {
    double dx = target.x() - position.x();
    double dy = target.y() - position.y();
    double dz = target.z() - position.z();
    double horizontal = Math.sqrt(dx * dx + dy * dy);
    double total = Math.sqrt(dx * dx + dy * dy + dz * dz);
    if (total == 0.0) {
      return new CameraRotation(Math.PI / 2, 0.0, 0.0);
    }

    double pitch;
    if (horizontal > 0.0) {
      pitch = Math.atan2(dz, horizontal);
    } else {
      pitch = dz > 0 ? Math.PI / 2 : -Math.PI / 2;
    }
    return new CameraRotation(Math.PI / 2 - pitch, 0.0, Math.atan2(dx, dy));
  }
}
