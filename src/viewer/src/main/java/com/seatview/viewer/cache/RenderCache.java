package com.seatview.viewer.cache;

import com.seatview.mapper.camera.Fingerprint;
import com.seatview.viewer.render.RenderException;
import com.seatview.viewer.render.RenderFatalException;
import com.seatview.viewer.render.RenderTimeoutException;
import com.seatview.viewer.render.RenderTransientException;
import com.seatview.viewer.render.RenderedImage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory, content-addressed store of rendered views.
 *
 * <p>This component:
 * <ul>
 *   <li>runs at most one render per fingerprint at a time; concurrent callers share its outcome</li>
 *   <li>bounds every render by a timeout and clears in-flight state on any failure</li>
 *   <li>evicts least-recently-used entries synchronously once a byte or entry bound is exceeded</li>
 *   <li>expires entries lazily on lookup once they are older than the TTL</li>
 * </ul>
 *
 * <p>A single lock guards the entry map, the in-flight map and the byte count. Renders run on
 * the supplied executor, outside the lock.
 */
public class RenderCache {
  private static final Logger log = LoggerFactory.getLogger(RenderCache.class);

  /**
   * Cache bounds.
   *
   * @param maxBytes upper bound on the summed size of stored images
   * @param maxEntries upper bound on the number of stored images
   * @param ttl age after which a stored image counts as a miss
   * @param renderTimeout time budget of one shared render, retries included
   */
  public record Settings(long maxBytes, int maxEntries, Duration ttl, Duration renderTimeout) {
    public Settings {
      if (maxBytes <= 0 || maxEntries <= 0) {
        throw new IllegalArgumentException("cache bounds must be positive");
      }
      if (ttl == null || ttl.isNegative() || ttl.isZero()) {
        throw new IllegalArgumentException("cache ttl must be positive");
      }
      if (renderTimeout == null || renderTimeout.isNegative() || renderTimeout.isZero()) {
        throw new IllegalArgumentException("render timeout must be positive");
      }
    }
  }

  private final Settings settings;
  private final Executor renderExecutor;
  private final Clock clock;
  private final Object lock = new Object();
  private final LinkedHashMap<Fingerprint, CacheEntry> entries = new LinkedHashMap<>(256, 0.75f, true);
  private final Map<Fingerprint, CompletableFuture<RenderedImage>> inFlight = new HashMap<>();
  private long totalBytes;

  private final Counter hitCounter;
  private final Counter missCounter;
  private final Counter coalescedCounter;
  private final Counter evictionCounter;
  private final Counter expirationCounter;
  private final Counter timeoutCounter;
  private final Counter failureCounter;
  private final Timer renderTimer;

  public RenderCache(Settings settings, Executor renderExecutor, Clock clock, MeterRegistry meterRegistry) {
    this.settings = settings;
    this.renderExecutor = renderExecutor;
    this.clock = clock;

    this.hitCounter = lookupCounter(meterRegistry, "hit");
    this.missCounter = lookupCounter(meterRegistry, "miss");
    this.coalescedCounter = lookupCounter(meterRegistry, "coalesced");
    this.evictionCounter = meterRegistry.counter("seatview.cache.evictions.total");
    this.expirationCounter = meterRegistry.counter("seatview.cache.expirations.total");
    this.timeoutCounter = meterRegistry.counter("seatview.cache.render.failures.total", "reason", "timeout");
    this.failureCounter = meterRegistry.counter("seatview.cache.render.failures.total", "reason", "error");
    this.renderTimer = Timer.builder("seatview.cache.render.duration")
        .description("Time from cache miss to render outcome (seconds)")
        .register(meterRegistry);

    meterRegistry.gauge("seatview.cache.entries", this, cache -> cache.stats().entries());
    meterRegistry.gauge("seatview.cache.bytes", this, cache -> cache.stats().totalBytes());
    meterRegistry.gauge("seatview.cache.in_flight", this, cache -> cache.stats().inFlight());
  }

  /**
   * Returns the cached image for a fingerprint, rendering it on a miss.
   *
   * <p>Blocks until the image is available. Every caller waiting on the same render receives the
   * same image, or the same {@link RenderException}.
   *
   * @param fingerprint cache key
   * @param renderFn render call, invoked only when this caller starts the render
   * @return rendered image
   * @throws RenderException when the shared render fails or times out
   * @throws CancellationException when the calling thread is interrupted while waiting
   */
  public RenderedImage getOrRender(Fingerprint fingerprint, Supplier<RenderedImage> renderFn) {
    CompletableFuture<RenderedImage> result = getOrRenderAsync(fingerprint, renderFn);
    try {
      return result.get();
    } catch (InterruptedException ex) {
      result.cancel(false);
      Thread.currentThread().interrupt();
      throw new CancellationException("interrupted while waiting for render " + fingerprint.shortValue());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RenderException renderException) {
        throw renderException;
      }
      throw new RenderFatalException("Unexpected render failure", cause);
    }
  }

  /**
   * Asynchronous variant of {@link #getOrRender(Fingerprint, Supplier)}.
   *
   * <p>Each caller gets its own future. Cancelling it detaches only that caller; the shared
   * render and the other waiters are not affected.
   *
   * @param fingerprint cache key
   * @param renderFn render call, invoked only when this caller starts the render
   * @return future completed with the image, or exceptionally with a {@link RenderException}
   */
  public CompletableFuture<RenderedImage> getOrRenderAsync(Fingerprint fingerprint, Supplier<RenderedImage> renderFn) {
    CompletableFuture<RenderedImage> shared;
    boolean owner = false;
    synchronized (lock) {
      CacheEntry entry = lookup(fingerprint);
      if (entry != null) {
        hitCounter.increment();
        return CompletableFuture.completedFuture(entry.image());
      }
      shared = inFlight.get(fingerprint);
      if (shared == null) {
        shared = new CompletableFuture<>();
        inFlight.put(fingerprint, shared);
        owner = true;
      }
    }

    if (owner) {
      missCounter.increment();
      log.debug("Cache miss for fingerprint {}, starting render", fingerprint.shortValue());
      startRender(fingerprint, renderFn, shared);
    } else {
      coalescedCounter.increment();
      log.debug("Fingerprint {} already rendering, waiting for shared result", fingerprint.shortValue());
    }
    return shared.copy();
  }

  /** Removes a stored entry. A render already in flight for the fingerprint is not affected. */
  public boolean invalidate(Fingerprint fingerprint) {
    synchronized (lock) {
      CacheEntry removed = entries.remove(fingerprint);
      if (removed == null) {
        return false;
      }
      totalBytes -= removed.sizeBytes();
      return true;
    }
  }

  /**
   * Drops every stored entry and detaches renders in flight.
   *
   * <p>A detached render still completes for the callers already waiting on it, but its image is
   * not stored, and the next request for that fingerprint starts a fresh render.
   *
   * @return number of stored entries removed
   */
  public int clear() {
    synchronized (lock) {
      int removed = entries.size();
      int detached = inFlight.size();
      entries.clear();
      inFlight.clear();
      totalBytes = 0L;
      if (detached > 0) {
        log.info("Cache cleared with {} renders in flight; their results will not be stored", detached);
      }
      return removed;
    }
  }

  /** Whether a live entry is stored. Counts as an access for LRU ordering. */
  public boolean contains(Fingerprint fingerprint) {
    synchronized (lock) {
      CacheEntry entry = entries.get(fingerprint);
      return entry != null && !isExpired(entry, clock.instant());
    }
  }

  public CacheStats stats() {
    synchronized (lock) {
      return new CacheStats(entries.size(), totalBytes, inFlight.size(), settings.maxEntries(), settings.maxBytes());
    }
  }

  public Settings settings() {
    return settings;
  }

  private void startRender(Fingerprint fingerprint, Supplier<RenderedImage> renderFn, CompletableFuture<RenderedImage> shared) {
    long startNs = System.nanoTime();
    CompletableFuture<RenderedImage> attempt;
    try {
      attempt = CompletableFuture.supplyAsync(renderFn, renderExecutor);
    } catch (RejectedExecutionException ex) {
      finish(fingerprint, shared, null, ex);
      return;
    }
    attempt
        .orTimeout(settings.renderTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((image, error) -> {
          renderTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
          finish(fingerprint, shared, image, error);
        });
  }

  private void finish(Fingerprint fingerprint, CompletableFuture<RenderedImage> shared, RenderedImage image, Throwable error) {
    if (error == null && image == null) {
      error = new RenderFatalException("Render returned no image");
    }
    if (error != null) {
      RenderException failure = translate(error);
      synchronized (lock) {
        inFlight.remove(fingerprint, shared);
      }
      if (failure instanceof RenderTimeoutException) {
        timeoutCounter.increment();
      } else {
        failureCounter.increment();
      }
      log.warn("Render failed for fingerprint {}: {}", fingerprint.shortValue(), failure.getMessage());
      shared.completeExceptionally(failure);
      return;
    }

    synchronized (lock) {
      // Not registered any more when a clear() ran during the render.
      if (inFlight.remove(fingerprint, shared)) {
        store(fingerprint, image);
      } else {
        log.debug("Render for fingerprint {} finished after a clear; not cached", fingerprint.shortValue());
      }
    }
    shared.complete(image);
  }

  private RenderException translate(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof RenderException renderException) {
      return renderException;
    }
    if (cause instanceof TimeoutException) {
      return new RenderTimeoutException("Render exceeded " + settings.renderTimeout().toMillis() + " ms", cause);
    }
    if (cause instanceof RejectedExecutionException) {
      return new RenderTransientException("Render executor rejected the job", cause);
    }
    return new RenderFatalException("Unexpected render failure: " + cause, cause);
  }

  // Caller holds the lock.
  private CacheEntry lookup(Fingerprint fingerprint) {
    CacheEntry entry = entries.get(fingerprint);
    if (entry == null) {
      return null;
    }
    Instant now = clock.instant();
    if (isExpired(entry, now)) {
      entries.remove(fingerprint);
      totalBytes -= entry.sizeBytes();
      expirationCounter.increment();
      log.debug("Fingerprint {} expired after {}", fingerprint.shortValue(), settings.ttl());
      return null;
    }
    entry.touch(now);
    return entry;
  }

  // Caller holds the lock.
  private void store(Fingerprint fingerprint, RenderedImage image) {
    if (image.sizeBytes() > settings.maxBytes()) {
      log.warn("Render for fingerprint {} is {} bytes, above the cache bound of {}; not cached",
          fingerprint.shortValue(), image.sizeBytes(), settings.maxBytes());
      return;
    }
    CacheEntry previous = entries.put(fingerprint, new CacheEntry(fingerprint, image, clock.instant()));
    if (previous != null) {
      totalBytes -= previous.sizeBytes();
    }
    totalBytes += image.sizeBytes();
    evictIfNeeded();
  }

  // Caller holds the lock. Access order puts the least recently used entry first.
  private void evictIfNeeded() {
    Iterator<CacheEntry> eldestFirst = entries.values().iterator();
    while ((totalBytes > settings.maxBytes() || entries.size() > settings.maxEntries()) && eldestFirst.hasNext()) {
      CacheEntry evicted = eldestFirst.next();
      eldestFirst.remove();
      totalBytes -= evicted.sizeBytes();
      evictionCounter.increment();
      log.debug("Evicted fingerprint {} ({} bytes, last access {})",
          evicted.fingerprint().shortValue(), evicted.sizeBytes(), evicted.lastAccessAt());
    }
  }

  private boolean isExpired(CacheEntry entry, Instant now) {
    return Duration.between(entry.createdAt(), now).compareTo(settings.ttl()) > 0;
  }

  private static Counter lookupCounter(MeterRegistry meterRegistry, String result) {
    return Counter.builder("seatview.cache.lookups.total")
        .description("Render cache lookups (by result)")
        .tag("result", result)
        .register(meterRegistry);
  }
}
