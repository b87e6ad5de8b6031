package com.seatview.mapper.venue;

/**
 * Seating level shared by one or more sections.
 *
 * @param id tier number, for example {@code 100}
 * @param elevation height above the field plane, in meters
 * @param minDistance distance of the front row from field center, in meters
 * @param maxDistance distance of the back row from field center, in meters
 */
public record Tier(int id, double elevation, double minDistance, double maxDistance) {

  /**
   * Interpolates the seat distance for a depth fraction.
   *
   * @param depth 0 for the front row, 1 for the back row
   * @return distance from field center in meters
   */
  public double distanceAt(double depth) {
    return minDistance + depth * (maxDistance - minDistance);
  }
}
