package com.seatview.mapper.camera;

import java.util.Objects;

/**
 * Content address of a rendered view.
 *
 * @param value lowercase hex SHA-256 digest
 */
public record Fingerprint(String value) {

  public Fingerprint {
    Objects.requireNonNull(value, "value");
  }

  /** First twelve characters, for log lines. */
  public String shortValue() {
    return value.length() <= 12 ? value : value.substring(0, 12);
  }

  @Override
  public String toString() {
    return value;
  }
}
