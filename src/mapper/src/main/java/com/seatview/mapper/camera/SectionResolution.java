package com.seatview.mapper.camera;

/** How a click was matched to a section. */
public enum SectionResolution {
  /** Exactly one polygon contains the click. */
  CONTAINED,
  /** Several polygons contain the click; the lowest section id won. */
  OVERLAPPING,
  /** No polygon contains the click; the section with the closest centroid was used. */
  NEAREST_FALLBACK;

  public boolean isOutOfBounds() {
    return this == NEAREST_FALLBACK;
  }
}
