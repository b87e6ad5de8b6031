package com.seatview.viewer.model;

import com.seatview.mapper.camera.CameraPose;
import com.seatview.mapper.camera.MappingResult;
import java.util.Locale;

/**
 * Camera pose payload returned by the pose endpoint.
 *
 * @param venueId venue identifier
 * @param sectionId resolved section
 * @param resolution {@code contained|overlapping|nearest_fallback}
 * @param outOfBounds whether the click fell outside every section polygon
 * @param position camera position in meters
 * @param target look-at point in meters
 * @param rotation camera rotation in radians
 * @param fov horizontal field of view in degrees
 * @param distance horizontal distance from field center in meters
 * @param angleDegrees angle around field center in degrees
 * @param fingerprint content fingerprint of the preview render
 */
public record PoseResponse(
    String venueId,
    String sectionId,
    String resolution,
    boolean outOfBounds,
    Vector position,
    Vector target,
    Vector rotation,
    double fov,
    double distance,
    double angleDegrees,
    String fingerprint) {

  /** Three-component vector as serialized to clients. */
  public record Vector(double x, double y, double z) {}

  public static PoseResponse from(MappingResult result, String fingerprint) {
    CameraPose pose = result.pose();
    return new PoseResponse(
        pose.venueId(),
        pose.sectionId(),
        result.resolution().name().toLowerCase(Locale.ROOT),
        result.resolution().isOutOfBounds(),
        new Vector(pose.position().x(), pose.position().y(), pose.position().z()),
        new Vector(pose.target().x(), pose.target().y(), pose.target().z()),
        new Vector(pose.rotation().x(), pose.rotation().y(), pose.rotation().z()),
        pose.fov(),
        result.distance(),
        result.angleDegrees(),
        fingerprint);
  }
}
