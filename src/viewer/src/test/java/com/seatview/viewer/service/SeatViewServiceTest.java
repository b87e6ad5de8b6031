package com.seatview.viewer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.camera.CoordinateMapper;
import com.seatview.mapper.camera.Fingerprinter;
import com.seatview.mapper.camera.MappingResult;
import com.seatview.mapper.camera.SectionResolution;
import com.seatview.viewer.TestVenues;
import com.seatview.viewer.api.NotFoundException;
import com.seatview.viewer.cache.RenderCache;
import com.seatview.viewer.render.RenderClient;
import com.seatview.viewer.render.RenderQuality;
import com.seatview.viewer.render.RenderRequest;
import com.seatview.viewer.render.RenderedImage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SeatViewServiceTest {

  @Mock private VenueCatalogService catalog;
  @Mock private RenderClient renderClient;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private ExecutorService renderExecutor;
  private RenderCache renderCache;
  private SeatViewService service;

  @BeforeEach
  void setUp() {
    renderExecutor = Executors.newFixedThreadPool(2);
    renderCache = new RenderCache(
        new RenderCache.Settings(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(5)),
        renderExecutor,
        Clock.systemUTC(),
        meterRegistry);
    service = new SeatViewService(
        catalog, new CoordinateMapper(), new Fingerprinter(), renderCache, renderClient, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    renderExecutor.shutdownNow();
  }

  @Test
  void mapCountsResolution() {
    when(catalog.venue(TestVenues.YANKEE)).thenReturn(TestVenues.yankeeStadium());

    MappingResult inside = service.map(TestVenues.YANKEE, new ClickPoint(0.5, 0.75));
    MappingResult outside = service.map(TestVenues.YANKEE, new ClickPoint(0.02, 0.02));

    assertThat(inside.sectionId()).isEqualTo("101");
    assertThat(outside.resolution()).isEqualTo(SectionResolution.NEAREST_FALLBACK);
    assertThat(resolutions("contained")).isEqualTo(1.0);
    assertThat(resolutions("nearest_fallback")).isEqualTo(1.0);
  }

  @Test
  void renderGoesThroughCacheOncePerFingerprint() {
    when(catalog.venue(TestVenues.YANKEE)).thenReturn(TestVenues.yankeeStadium());
    RenderedImage image = new RenderedImage(new byte[] {7, 7, 7}, RenderedImage.PNG);
    when(renderClient.render(any(RenderRequest.class))).thenReturn(image);

    SeatViewService.SeatView first = service.render(TestVenues.YANKEE, new ClickPoint(0.5, 0.75), RenderQuality.PREVIEW);
    SeatViewService.SeatView second = service.render(TestVenues.YANKEE, new ClickPoint(0.5, 0.75), RenderQuality.PREVIEW);

    assertThat(first.image()).isSameAs(image);
    assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
    verify(renderClient, times(1)).render(any(RenderRequest.class));

    ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
    verify(renderClient).render(captor.capture());
    assertThat(captor.getValue().templateId()).isEqualTo("yankee_stadium.blend");
    assertThat(captor.getValue().pose().sectionId()).isEqualTo("101");
  }

  @Test
  void qualitiesAreCachedSeparately() {
    when(catalog.venue(TestVenues.YANKEE)).thenReturn(TestVenues.yankeeStadium());
    when(renderClient.render(any(RenderRequest.class)))
        .thenReturn(new RenderedImage(new byte[] {1}, RenderedImage.PNG));

    SeatViewService.SeatView preview = service.render(TestVenues.YANKEE, new ClickPoint(0.5, 0.75), RenderQuality.PREVIEW);
    SeatViewService.SeatView full = service.render(TestVenues.YANKEE, new ClickPoint(0.5, 0.75), RenderQuality.FULL);

    assertThat(preview.fingerprint()).isNotEqualTo(full.fingerprint());
    verify(renderClient, times(2)).render(any(RenderRequest.class));
  }

  @Test
  void unknownVenueIsNotFound() {
    when(catalog.venue("nowhere")).thenThrow(new NotFoundException("venue not found: nowhere"));

    assertThatThrownBy(() -> service.render("nowhere", new ClickPoint(0.5, 0.5), RenderQuality.PREVIEW))
        .isInstanceOf(NotFoundException.class);
    verify(renderClient, never()).render(any(RenderRequest.class));
  }

  private double resolutions(String resolution) {
    return meterRegistry.get("seatview.mapping.resolutions").tag("resolution", resolution).counter().count();
  }
}
