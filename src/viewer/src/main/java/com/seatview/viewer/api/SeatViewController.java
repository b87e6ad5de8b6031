package com.seatview.viewer.api;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.camera.MappingResult;
import com.seatview.mapper.venue.VenueModel;
import com.seatview.mapper.venue.VenueRegistry;
import com.seatview.viewer.cache.CacheStats;
import com.seatview.viewer.cache.RenderCache;
import com.seatview.viewer.model.CacheStatsResponse;
import com.seatview.viewer.model.PoseResponse;
import com.seatview.viewer.model.ReloadResponse;
import com.seatview.viewer.model.VenueSummary;
import com.seatview.viewer.render.RenderQuality;
import com.seatview.viewer.service.ClickParser;
import com.seatview.viewer.service.SeatViewService;
import com.seatview.viewer.service.VenueCatalogService;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for venue discovery, seat poses and rendered seat views.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/venues}: loaded venues</li>
 *   <li>{@code GET /api/venues/{venueId}/pose}: camera pose for a click</li>
 *   <li>{@code GET /api/venues/{venueId}/view}: rendered image for a click</li>
 *   <li>{@code POST /api/venues/reload}: re-read venue configurations</li>
 *   <li>{@code GET /api/cache/stats}: render cache occupancy</li>
 * </ul>
 *
 * <p>Clicks are given either as normalized {@code x,y} or as seatmap pixels {@code px,py}.
 */
@RestController
@RequestMapping("/api")
public class SeatViewController {
  private static final Logger log = LoggerFactory.getLogger(SeatViewController.class);

  static final String FINGERPRINT_HEADER = "X-Seatview-Fingerprint";
  static final String SECTION_HEADER = "X-Seatview-Section";
  static final String RESOLUTION_HEADER = "X-Seatview-Resolution";

  private final VenueCatalogService catalog;
  private final SeatViewService seatViewService;
  private final RenderCache renderCache;

  public SeatViewController(
      VenueCatalogService catalog,
      SeatViewService seatViewService,
      RenderCache renderCache) {
    this.catalog = catalog;
    this.seatViewService = seatViewService;
    this.renderCache = renderCache;
  }

  @GetMapping("/venues")
  public List<VenueSummary> listVenues() {
    return catalog.venues().stream().map(VenueSummary::from).toList();
  }

  @GetMapping("/venues/{venueId}")
  public VenueSummary venue(@PathVariable("venueId") String venueId) {
    return VenueSummary.from(catalog.venue(venueId));
  }

  /**
   * Returns the camera pose for a click without rendering.
   *
   * @param venueId venue identifier
   * @param x optional normalized horizontal position
   * @param y optional normalized vertical position
   * @param px optional pixel column
   * @param py optional pixel row
   * @return pose payload, including the preview fingerprint
   */
  @GetMapping("/venues/{venueId}/pose")
  public PoseResponse pose(
      @PathVariable("venueId") String venueId,
      @RequestParam(value = "x", required = false) String x,
      @RequestParam(value = "y", required = false) String y,
      @RequestParam(value = "px", required = false) String px,
      @RequestParam(value = "py", required = false) String py) {
    ClickPoint click = parseClick(venueId, x, y, px, py);
    MappingResult mapping = seatViewService.map(venueId, click);
    String fingerprint = seatViewService.fingerprint(venueId, mapping, RenderQuality.PREVIEW).value();
    return PoseResponse.from(mapping, fingerprint);
  }

  /**
   * Returns the rendered view from a seat.
   *
   * <p>Blocks until the shared render finishes. Render failures are translated by
   * {@link ApiExceptionHandler}.
   *
   * @param venueId venue identifier
   * @param x optional normalized horizontal position
   * @param y optional normalized vertical position
   * @param px optional pixel column
   * @param py optional pixel row
   * @param quality {@code preview} (default) or {@code full}
   * @return encoded image with mapping headers
   */
  @GetMapping("/venues/{venueId}/view")
  public ResponseEntity<byte[]> view(
      @PathVariable("venueId") String venueId,
      @RequestParam(value = "x", required = false) String x,
      @RequestParam(value = "y", required = false) String y,
      @RequestParam(value = "px", required = false) String px,
      @RequestParam(value = "py", required = false) String py,
      @RequestParam(value = "quality", required = false) String quality) {
    ClickPoint click = parseClick(venueId, x, y, px, py);
    RenderQuality renderQuality = ClickParser.parseQuality(quality);
    SeatViewService.SeatView view = seatViewService.render(venueId, click, renderQuality);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(view.image().contentType()))
        .cacheControl(CacheControl.noCache())
        .eTag("\"" + view.fingerprint().value() + "\"")
        .header(FINGERPRINT_HEADER, view.fingerprint().value())
        .header(SECTION_HEADER, view.mapping().sectionId())
        .header(RESOLUTION_HEADER, view.mapping().resolution().name().toLowerCase(Locale.ROOT))
        .body(view.image().data());
  }

  /**
   * Re-reads the venue directory and drops cached renders.
   *
   * @return loaded and rejected venues
   */
  @PostMapping("/venues/reload")
  public ReloadResponse reload() {
    VenueRegistry.LoadReport report = catalog.reload();
    int cleared = renderCache.clear();
    log.info("Venue reload: loaded={}, rejected={}, cleared {} cached renders",
        report.loaded(), report.rejected().keySet(), cleared);
    return new ReloadResponse(report.loaded(), report.rejected(), cleared);
  }

  @GetMapping("/cache/stats")
  public CacheStatsResponse cacheStats() {
    CacheStats stats = renderCache.stats();
    return CacheStatsResponse.from(stats);
  }

  private ClickPoint parseClick(String venueId, String x, String y, String px, String py) {
    VenueModel venue = catalog.venue(venueId);
    return ClickParser.parseClick(x, y, px, py, venue.seatmap());
  }
}
