package com.seatview.viewer.render;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries retryable render failures with exponential backoff.
 *
 * <p>Fatal failures are rethrown on the first attempt. After the last retry the most recent
 * failure is rethrown unchanged.
 */
public class RetryingRenderClient implements RenderClient {
  private static final Logger log = LoggerFactory.getLogger(RetryingRenderClient.class);

  private final RenderClient delegate;
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final Counter retryCounter;

  public RetryingRenderClient(
      RenderClient delegate,
      int maxRetries,
      Duration initialBackoff,
      Duration maxBackoff,
      MeterRegistry meterRegistry) {
    this.delegate = delegate;
    this.maxRetries = Math.max(0, maxRetries);
    this.initialBackoff = initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
    this.maxBackoff = maxBackoff.compareTo(this.initialBackoff) < 0 ? this.initialBackoff : maxBackoff;
    this.retryCounter = Counter.builder("seatview.render.retries.total")
        .description("Render attempts retried after a transient failure")
        .register(meterRegistry);
  }

  @Override
  public RenderedImage render(RenderRequest request) {
    int attempt = 0;
    while (true) {
      try {
        return delegate.render(request);
      } catch (RenderException ex) {
        if (!ex.isRetryable() || attempt >= maxRetries) {
          throw ex;
        }
        Duration backoff = backoffFor(attempt);
        attempt++;
        retryCounter.increment();
        log.warn("Render attempt {} for venue={} section={} failed ({}), retrying in {} ms",
            attempt, request.venueId(), request.pose().sectionId(), ex.getMessage(), backoff.toMillis());
        pause(backoff, ex);
      }
    }
  }

  Duration backoffFor(int attempt) {
    long factor = 1L << Math.min(attempt, 20);
    long millis = initialBackoff.toMillis() * factor;
    return millis > maxBackoff.toMillis() || millis < 0 ? maxBackoff : Duration.ofMillis(millis);
  }

  private static void pause(Duration backoff, RenderException lastFailure) {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw lastFailure;
    }
  }
}
