package com.seatview.mapper.camera;

import com.seatview.mapper.geometry.Point3D;

/**
 * Rendering viewpoint produced for one seat.
 *
 * <p>A pose is a deterministic function of the venue, the resolved section and the click's
 * position inside it.
 *
 * @param venueId venue the pose belongs to
 * @param sectionId section the click resolved to
 * @param position camera location in meters
 * @param target look-at point in meters
 * @param rotation camera orientation derived from position and target
 * @param fov horizontal field of view in degrees
 */
public record CameraPose(
    String venueId,
    String sectionId,
    Point3D position,
    Point3D target,
    CameraRotation rotation,
    double fov) {}
