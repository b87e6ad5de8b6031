package com.seatview.viewer.service;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.venue.SeatmapConfig;
import com.seatview.viewer.api.BadRequestException;
import com.seatview.viewer.render.RenderQuality;
import java.util.Locale;

/**
 * Utility class for parsing and validating click and render query parameters.
 */
public final class ClickParser {

  private ClickParser() {}

  /**
   * Builds a click from either normalized ({@code x,y}) or pixel ({@code px,py}) coordinates.
   *
   * @param x normalized horizontal position, or null
   * @param y normalized vertical position, or null
   * @param px pixel column on the seatmap image, or null
   * @param py pixel row on the seatmap image, or null
   * @param seatmap seatmap used to normalize pixel clicks
   * @return validated click
   */
  public static ClickPoint parseClick(String x, String y, String px, String py, SeatmapConfig seatmap) {
    boolean normalized = isPresent(x) || isPresent(y);
    boolean pixels = isPresent(px) || isPresent(py);
    if (normalized == pixels) {
      throw new BadRequestException("provide either x,y (normalized) or px,py (pixels)");
    }

    try {
      if (normalized) {
        return new ClickPoint(parseCoordinate("x", x), parseCoordinate("y", y));
      }
      return ClickPoint.fromPixels(
          parseCoordinate("px", px), parseCoordinate("py", py), seatmap.width(), seatmap.height());
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException(ex.getMessage());
    }
  }

  /**
   * Parses a render quality name. Missing values default to {@link RenderQuality#PREVIEW}.
   *
   * @param raw raw quality value
   * @return render quality
   */
  public static RenderQuality parseQuality(String raw) {
    if (!isPresent(raw)) {
      return RenderQuality.PREVIEW;
    }
    try {
      return RenderQuality.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("quality must be preview or full");
    }
  }

  private static double parseCoordinate(String name, String raw) {
    if (!isPresent(raw)) {
      throw new BadRequestException(name + " is required");
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new BadRequestException(name + " must be a number");
    }
    if (!Double.isFinite(value)) {
      throw new BadRequestException(name + " must be finite");
    }
    return value;
  }

  private static boolean isPresent(String raw) {
    return raw != null && !raw.isBlank();
  }
}
