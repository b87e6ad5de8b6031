package com.seatview.viewer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatview.mapper.camera.CoordinateMapper;
import com.seatview.mapper.camera.Fingerprinter;
import com.seatview.mapper.camera.MapperSettings;
import com.seatview.mapper.venue.VenueLoader;
import com.seatview.mapper.venue.VenueRegistry;
import com.seatview.viewer.cache.RenderCache;
import com.seatview.viewer.render.HttpRenderClient;
import com.seatview.viewer.render.RenderClient;
import com.seatview.viewer.render.RetryingRenderClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(ViewerProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(100, properties.getRender().getConnectTimeoutMs())))
        .build();
  }

  @Bean
  public VenueLoader venueLoader() {
    return new VenueLoader();
  }

  @Bean
  public VenueRegistry venueRegistry() {
    return new VenueRegistry();
  }

  @Bean
  public CoordinateMapper coordinateMapper(ViewerProperties properties) {
    ViewerProperties.Camera camera = properties.getCamera();
    return new CoordinateMapper(new MapperSettings(
        camera.getMinFov(), camera.getMaxFov(), camera.getNearDistance(), camera.getFarDistance()));
  }

  @Bean
  public Fingerprinter fingerprinter(ViewerProperties properties) {
    ViewerProperties.Fingerprint fingerprint = properties.getFingerprint();
    return new Fingerprinter(fingerprint.getPositionPrecision(), fingerprint.getFovPrecision());
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService renderExecutor(ViewerProperties properties) {
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory threads = runnable -> {
      Thread thread = new Thread(runnable, "render-worker-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(Math.max(1, properties.getCache().getRenderThreads()), threads);
  }

  @Bean
  public RenderCache renderCache(ViewerProperties properties, ExecutorService renderExecutor, MeterRegistry meterRegistry) {
    ViewerProperties.Cache cache = properties.getCache();
    RenderCache.Settings settings = new RenderCache.Settings(
        cache.getMaxBytes(), cache.getMaxEntries(), cache.getTtl(), cache.getRenderTimeout());
    return new RenderCache(settings, renderExecutor, Clock.systemUTC(), meterRegistry);
  }

  @Bean
  public RenderClient renderClient(
      ViewerProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    ViewerProperties.Render render = properties.getRender();
    return new RetryingRenderClient(
        new HttpRenderClient(render, httpClient, objectMapper, meterRegistry),
        render.getMaxRetries(),
        Duration.ofMillis(render.getInitialBackoffMs()),
        Duration.ofMillis(render.getMaxBackoffMs()),
        meterRegistry);
  }
}
