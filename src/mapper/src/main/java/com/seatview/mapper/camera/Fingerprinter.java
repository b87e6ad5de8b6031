package com.seatview.mapper.camera;

import com.seatview.mapper.geometry.Point3D;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives render-cache keys from camera poses.
 *
 * <p>Every pose field is quantized to a whole number of precision steps before hashing, so clicks
 * a few centimeters apart collapse onto the same cached render. The section id is part of the
 * key; two sections never share a fingerprint.
 */
public class Fingerprinter {
  public static final double DEFAULT_POSITION_PRECISION = 0.5;
  public static final double DEFAULT_FOV_PRECISION = 1.0;
  private static final String KEY_VERSION = "v1";

  private final double positionPrecision;
  private final double fovPrecision;

  public Fingerprinter() {
    this(DEFAULT_POSITION_PRECISION, DEFAULT_FOV_PRECISION);
  }

  /**
   * Creates a fingerprinter.
   *
   * @param positionPrecision grid size for position and target coordinates, in meters
   * @param fovPrecision grid size for the field of view, in degrees
   */
  public Fingerprinter(double positionPrecision, double fovPrecision) {
    if (!(positionPrecision > 0) || !(fovPrecision > 0)) {
      throw new IllegalArgumentException("fingerprint precision must be positive");
    }
    this.positionPrecision = positionPrecision;
    this.fovPrecision = fovPrecision;
  }

  public Fingerprint fingerprint(CameraPose pose, String templateId) {
    return fingerprint(pose, templateId, "");
  }

  /**
   * Computes the fingerprint of a pose.
   *
   * @param pose camera pose
   * @param templateId render template of the venue
   * @param variant render variant sharing the pose (for example an output quality), may be empty
   * @return stable fingerprint
   */
  public Fingerprint fingerprint(CameraPose pose, String templateId, String variant) {
    return new Fingerprint(sha256(canonicalKey(pose, templateId, variant)));
  }

  String canonicalKey(CameraPose pose, String templateId, String variant) {
    StringBuilder key = new StringBuilder(160)
        .append(KEY_VERSION)
        .append('|').append(pose.venueId())
        .append('|').append(templateId)
        .append('|').append(variant == null ? "" : variant)
        .append('|').append(pose.sectionId());
    appendPoint(key, pose.position());
    appendPoint(key, pose.target());
    key.append('|').append(quantize(pose.fov(), fovPrecision));
    return key.toString();
  }

  private void appendPoint(StringBuilder key, Point3D point) {
    key.append('|').append(quantize(point.x(), positionPrecision))
        .append(',').append(quantize(point.y(), positionPrecision))
        .append(',').append(quantize(point.z(), positionPrecision));
  }

  static long quantize(double value, double precision) {
    return Math.round(value / precision);
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder builder = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        builder.append(String.format("%02x", b));
      }
      return builder.toString();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
    }
  }
}
