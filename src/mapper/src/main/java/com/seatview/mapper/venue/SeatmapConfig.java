package com.seatview.mapper.venue;

/**
 * Seatmap image used as the click surface.
 *
 * @param file image file name, relative to the venue directory
 * @param width image width in pixels
 * @param height image height in pixels
 */
public record SeatmapConfig(String file, int width, int height) {}
