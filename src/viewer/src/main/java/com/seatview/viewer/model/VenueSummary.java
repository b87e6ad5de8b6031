package com.seatview.viewer.model;

import com.seatview.mapper.venue.VenueModel;

/**
 * Venue entry of the venue list endpoint.
 *
 * @param id venue identifier
 * @param name display name
 * @param type venue type ({@code baseball|football|hockey|basketball})
 * @param seatmapFile seatmap image file name
 * @param seatmapWidth seatmap width in pixels
 * @param seatmapHeight seatmap height in pixels
 * @param sectionCount number of sections
 */
public record VenueSummary(
    String id,
    String name,
    String type,
    String seatmapFile,
    int seatmapWidth,
    int seatmapHeight,
    int sectionCount) {

  public static VenueSummary from(VenueModel venue) {
    return new VenueSummary(
        venue.id(),
        venue.name(),
        venue.type().configValue(),
        venue.seatmap().file(),
        venue.seatmap().width(),
        venue.seatmap().height(),
        venue.sections().size());
  }
}
