package com.seatview.mapper.geometry;

/**
 * Result of a nearest-centroid lookup.
 *
 * @param sectionId identifier of the closest section
 * @param distance distance from the click to that section's centroid, in normalized units
 */
public record NearestSection(String sectionId, double distance) {}
