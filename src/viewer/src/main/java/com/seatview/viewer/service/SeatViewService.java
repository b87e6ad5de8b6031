package com.seatview.viewer.service;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.camera.CoordinateMapper;
import com.seatview.mapper.camera.Fingerprint;
import com.seatview.mapper.camera.Fingerprinter;
import com.seatview.mapper.camera.MappingResult;
import com.seatview.mapper.camera.SectionResolution;
import com.seatview.mapper.venue.VenueModel;
import com.seatview.viewer.cache.RenderCache;
import com.seatview.viewer.render.RenderClient;
import com.seatview.viewer.render.RenderQuality;
import com.seatview.viewer.render.RenderRequest;
import com.seatview.viewer.render.RenderedImage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns seatmap clicks into camera poses and rendered views.
 *
 * <p>Rendering goes through {@link RenderCache}, so concurrent requests for the same view share
 * one backend render.
 */
@Service
public class SeatViewService {
  private static final Logger log = LoggerFactory.getLogger(SeatViewService.class);

  /**
   * A rendered seat view.
   *
   * @param mapping pose and mapping details
   * @param fingerprint cache key of the render
   * @param image rendered image
   */
  public record SeatView(MappingResult mapping, Fingerprint fingerprint, RenderedImage image) {}

  private final VenueCatalogService catalog;
  private final CoordinateMapper mapper;
  private final Fingerprinter fingerprinter;
  private final RenderCache renderCache;
  private final RenderClient renderClient;
  private final Map<SectionResolution, Counter> resolutionCounters = new EnumMap<>(SectionResolution.class);

  public SeatViewService(
      VenueCatalogService catalog,
      CoordinateMapper mapper,
      Fingerprinter fingerprinter,
      RenderCache renderCache,
      RenderClient renderClient,
      MeterRegistry meterRegistry) {
    this.catalog = catalog;
    this.mapper = mapper;
    this.fingerprinter = fingerprinter;
    this.renderCache = renderCache;
    this.renderClient = renderClient;
    for (SectionResolution resolution : SectionResolution.values()) {
      resolutionCounters.put(resolution, Counter.builder("seatview.mapping.resolutions")
          .description("Seatmap clicks mapped to a section (by resolution)")
          .tag("resolution", resolution.name().toLowerCase(Locale.ROOT))
          .register(meterRegistry));
    }
  }

  /**
   * Maps a click to a camera pose.
   *
   * @param venueId venue identifier
   * @param click normalized click
   * @return mapping result
   */
  public MappingResult map(String venueId, ClickPoint click) {
    return map(catalog.venue(venueId), click);
  }

  /**
   * Fingerprint a render of this mapping would be stored under.
   *
   * @param venueId venue identifier
   * @param mapping mapping result
   * @param quality render preset
   * @return fingerprint
   */
  public Fingerprint fingerprint(String venueId, MappingResult mapping, RenderQuality quality) {
    return fingerprinter.fingerprint(mapping.pose(), catalog.venue(venueId).templateId(), quality.variant());
  }

  /**
   * Maps a click and returns its rendered view, from cache when available.
   *
   * @param venueId venue identifier
   * @param click normalized click
   * @param quality render preset
   * @return rendered seat view
   */
  public SeatView render(String venueId, ClickPoint click, RenderQuality quality) {
    VenueModel venue = catalog.venue(venueId);
    MappingResult mapping = map(venue, click);
    Fingerprint fingerprint = fingerprinter.fingerprint(mapping.pose(), venue.templateId(), quality.variant());
    RenderRequest request = new RenderRequest(venue.id(), venue.templateId(), mapping.pose(), quality);
    RenderedImage image = renderCache.getOrRender(fingerprint, () -> renderClient.render(request));
    return new SeatView(mapping, fingerprint, image);
  }

  private MappingResult map(VenueModel venue, ClickPoint click) {
    MappingResult result = mapper.map(click, venue);
    resolutionCounters.get(result.resolution()).increment();
    if (result.resolution() == SectionResolution.NEAREST_FALLBACK) {
      log.info("Click ({}, {}) on venue {} outside every section, using nearest section {} at {}",
          click.x(), click.y(), venue.id(), result.sectionId(), result.fallbackDistance());
    } else if (result.resolution() == SectionResolution.OVERLAPPING) {
      log.warn("Click ({}, {}) on venue {} matched overlapping sections, using {}",
          click.x(), click.y(), venue.id(), result.sectionId());
    }
    return result;
  }
}
