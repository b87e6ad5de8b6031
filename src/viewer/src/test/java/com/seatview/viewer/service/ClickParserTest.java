package com.seatview.viewer.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.venue.SeatmapConfig;
import com.seatview.viewer.api.BadRequestException;
import com.seatview.viewer.render.RenderQuality;
import org.junit.jupiter.api.Test;

class ClickParserTest {
  private static final SeatmapConfig SEATMAP = new SeatmapConfig("seatmap.png", 1280, 960);

  @Test
  void parsesNormalizedClick() {
    assertEquals(new ClickPoint(0.5, 0.75), ClickParser.parseClick("0.5", " 0.75 ", null, null, SEATMAP));
  }

  @Test
  void normalizesPixelClick() {
    assertEquals(new ClickPoint(0.5, 0.75), ClickParser.parseClick(null, null, "640", "720", SEATMAP));
  }

  @Test
  void rejectsMixedOrMissingCoordinates() {
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick("0.5", "0.5", "10", "10", SEATMAP));
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick(null, null, null, null, SEATMAP));
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick("0.5", null, null, null, SEATMAP));
  }

  @Test
  void rejectsOutOfRangeAndNonNumericValues() {
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick("1.5", "0.5", null, null, SEATMAP));
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick("abc", "0.5", null, null, SEATMAP));
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick("NaN", "0.5", null, null, SEATMAP));
    assertThrows(BadRequestException.class, () -> ClickParser.parseClick(null, null, "1300", "10", SEATMAP));
  }

  @Test
  void parsesQualityWithPreviewDefault() {
    assertEquals(RenderQuality.PREVIEW, ClickParser.parseQuality(null));
    assertEquals(RenderQuality.FULL, ClickParser.parseQuality("Full"));
    assertThrows(BadRequestException.class, () -> ClickParser.parseQuality("ultra"));
  }
}
