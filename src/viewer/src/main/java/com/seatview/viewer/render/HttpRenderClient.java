package com.seatview.viewer.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatview.mapper.camera.CameraPose;
import com.seatview.viewer.config.ViewerProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RenderClient} calling the GPU render backend over HTTP.
 *
 * <p>The backend accepts a JSON job on {@code POST {baseUrl}/render} and answers with the encoded
 * image. One call is one attempt; retries belong to {@link RetryingRenderClient}.
 */
public class HttpRenderClient implements RenderClient {
  private static final Logger log = LoggerFactory.getLogger(HttpRenderClient.class);
  private static final int MAX_ERROR_DETAIL_CHARS = 200;

  private final ViewerProperties.Render properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer renderRequestTimer;
  private final Counter successCounter;
  private final Counter fatalCounter;
  private final Counter transientCounter;
  private final Counter timeoutCounter;

  public HttpRenderClient(
      ViewerProperties.Render properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.renderRequestTimer = Timer.builder("seatview.render.http.duration")
        .description("Render backend HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);

    // Keep cardinality low: a handful of outcomes, no venue or URL labels.
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.fatalCounter = outcomeCounter(meterRegistry, "fatal");
    this.transientCounter = outcomeCounter(meterRegistry, "transient");
    this.timeoutCounter = outcomeCounter(meterRegistry, "timeout");
  }

  @Override
  public RenderedImage render(RenderRequest request) {
    String baseUrl = properties.getBaseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new RenderFatalException("Render backend base URL is missing.");
    }

    String body;
    try {
      body = objectMapper.writeValueAsString(payload(request));
    } catch (JsonProcessingException ex) {
      throw new RenderFatalException("Unable to encode render job", ex);
    }

    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl.replaceAll("/+$", "") + "/render"))
        .timeout(Duration.ofMillis(Math.max(1000, properties.getRequestTimeoutMs())))
        .header("Content-Type", "application/json")
        .header("Accept", "image/png")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    String token = properties.getApiToken();
    if (token != null && !token.isBlank()) {
      builder.header("Authorization", "Bearer " + token);
    }

    long startNs = System.nanoTime();
    try {
      HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        byte[] image = response.body();
        if (image == null || image.length == 0) {
          transientCounter.increment();
          throw new RenderTransientException("Render backend returned an empty image", status);
        }
        successCounter.increment();
        String contentType = response.headers().firstValue("Content-Type").orElse(RenderedImage.PNG);
        log.debug("Rendered venue={} section={} quality={} bytes={}",
            request.venueId(), request.pose().sectionId(), request.quality(), image.length);
        return new RenderedImage(image, contentType);
      }

      String detail = errorDetail(response.body());
      if (isTransientStatus(status)) {
        transientCounter.increment();
        log.warn("Render backend unavailable: status={}, venue={}, detail={}", status, request.venueId(), detail);
        throw new RenderTransientException("Render backend returned status " + status, status);
      }
      fatalCounter.increment();
      log.warn("Render backend rejected job: status={}, venue={}, template={}, detail={}",
          status, request.venueId(), request.templateId(), detail);
      throw new RenderFatalException("Render backend rejected job with status " + status + ": " + detail);
    } catch (HttpTimeoutException ex) {
      timeoutCounter.increment();
      throw new RenderTimeoutException("Render backend did not answer within "
          + properties.getRequestTimeoutMs() + " ms", ex);
    } catch (IOException ex) {
      transientCounter.increment();
      throw new RenderTransientException("Render backend request failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      transientCounter.increment();
      throw new RenderTransientException("Render request interrupted", ex);
    } finally {
      renderRequestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }
  }

  Map<String, Object> payload(RenderRequest request) {
    CameraPose pose = request.pose();
    Map<String, Object> job = new LinkedHashMap<>();
    job.put("venue_id", request.venueId());
    job.put("template_name", request.templateId());
    job.put("camera_x", pose.position().x());
    job.put("camera_y", pose.position().y());
    job.put("camera_z", pose.position().z());
    job.put("rotation_x", pose.rotation().x());
    job.put("rotation_y", pose.rotation().y());
    job.put("rotation_z", pose.rotation().z());
    job.put("fov", pose.fov());
    job.put("width", request.quality().width());
    job.put("height", request.quality().height());
    job.put("samples", request.quality().samples());
    return job;
  }

  static boolean isTransientStatus(int status) {
    return status == 408 || status == 425 || status == 429 || (status >= 500 && status != 501);
  }

  private static String errorDetail(byte[] body) {
    if (body == null || body.length == 0) {
      return "";
    }
    String text = new String(body, StandardCharsets.UTF_8).strip();
    return text.length() <= MAX_ERROR_DETAIL_CHARS ? text : text.substring(0, MAX_ERROR_DETAIL_CHARS);
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("seatview.render.http.requests.total")
        .description("Render backend HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
