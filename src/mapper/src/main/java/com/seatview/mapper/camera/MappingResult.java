package com.seatview.mapper.camera;

/**
 * Camera pose plus the intermediate values that produced it.
 *
 * @param pose resulting camera pose
 * @param resolution how the section was chosen
 * @param depth row fraction used for the distance (0 front, 1 back)
 * @param lateral position across the section (0.5 on its middle line)
 * @param distance horizontal distance from field center in meters
 * @param angleDegrees final angle around field center in degrees
 * @param fallbackDistance centroid distance for {@link SectionResolution#NEAREST_FALLBACK}, else 0
 */
public record MappingResult(
    CameraPose pose,
    SectionResolution resolution,
    double depth,
    double lateral,
    double distance,
    double angleDegrees,
    double fallbackDistance) {

  public String sectionId() {
    return pose.sectionId();
  }
}
