package com.seatview.viewer.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

import com.seatview.mapper.camera.Fingerprint;
import com.seatview.viewer.render.RenderFatalException;
import com.seatview.viewer.render.RenderTimeoutException;
import com.seatview.viewer.render.RenderTransientException;
import com.seatview.viewer.render.RenderedImage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RenderCacheTest {
  private static final Fingerprint A = new Fingerprint("aaaaaaaaaaaaaaaa");
  private static final Fingerprint B = new Fingerprint("bbbbbbbbbbbbbbbb");
  private static final Fingerprint C = new Fingerprint("cccccccccccccccc");

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  private final AtomicInteger renders = new AtomicInteger();
  private ExecutorService renderExecutor;

  @BeforeEach
  void setUp() {
    renderExecutor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    renderExecutor.shutdownNow();
  }

  @Test
  void concurrentCallersShareOneRender() throws Exception {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    int callers = 16;
    CountDownLatch release = new CountDownLatch(1);
    RenderedImage image = image(64);
    ExecutorService callerPool = Executors.newFixedThreadPool(callers);
    CyclicBarrier start = new CyclicBarrier(callers);

    try {
      List<Future<RenderedImage>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(callerPool.submit(() -> {
          start.await();
          return cache.getOrRender(A, blockingRender(release, image));
        }));
      }

      awaitCount("coalesced", callers - 1);
      assertThat(cache.stats().inFlight()).isEqualTo(1);
      release.countDown();

      for (Future<RenderedImage> result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(image);
      }
    } finally {
      release.countDown();
      callerPool.shutdownNow();
    }

    assertThat(renders.get()).isEqualTo(1);
    assertThat(lookups("miss")).isEqualTo(1.0);
    assertThat(cache.stats().inFlight()).isZero();
    assertThat(cache.stats().entries()).isEqualTo(1);
  }

  @Test
  void waitersAttachedBeforeCompletionGetTheSameImage() throws Exception {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    CountDownLatch release = new CountDownLatch(1);
    RenderedImage image = image(10);

    CompletableFuture<RenderedImage> first = cache.getOrRenderAsync(A, blockingRender(release, image));
    CompletableFuture<RenderedImage> second = cache.getOrRenderAsync(A, blockingRender(release, image(99)));
    CompletableFuture<RenderedImage> third = cache.getOrRenderAsync(A, blockingRender(release, image(99)));
    release.countDown();

    assertThat(first.get(5, TimeUnit.SECONDS)).isSameAs(image);
    assertThat(second.get(5, TimeUnit.SECONDS)).isSameAs(image);
    assertThat(third.get(5, TimeUnit.SECONDS)).isSameAs(image);
    assertThat(renders.get()).isEqualTo(1);
  }

  @Test
  void cachedImageIsServedWithoutRendering() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    RenderedImage image = image(32);

    assertThat(cache.getOrRender(A, render(image))).isSameAs(image);
    assertThat(cache.getOrRender(A, render(image(1)))).isSameAs(image);

    assertThat(renders.get()).isEqualTo(1);
    assertThat(lookups("hit")).isEqualTo(1.0);
    assertThat(cache.contains(A)).isTrue();
  }

  @Test
  void entryBoundEvictsLeastRecentlyUsed() {
    RenderCache cache = cache(1_000_000L, 2, Duration.ofHours(1), Duration.ofSeconds(10));

    cache.getOrRender(A, render(image(10)));
    cache.getOrRender(B, render(image(10)));
    cache.getOrRender(A, render(image(10)));
    cache.getOrRender(C, render(image(10)));

    assertThat(cache.contains(A)).isTrue();
    assertThat(cache.contains(B)).isFalse();
    assertThat(cache.contains(C)).isTrue();
    assertThat(cache.stats().entries()).isEqualTo(2);
    assertThat(meterRegistry.get("seatview.cache.evictions.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void byteBoundEvictsUntilWithinLimit() {
    RenderCache cache = cache(100L, 10, Duration.ofHours(1), Duration.ofSeconds(10));

    cache.getOrRender(A, render(image(40)));
    cache.getOrRender(B, render(image(40)));
    cache.getOrRender(C, render(image(40)));

    CacheStats stats = cache.stats();
    assertThat(stats.totalBytes()).isEqualTo(80L);
    assertThat(stats.totalBytes()).isLessThanOrEqualTo(stats.maxBytes());
    assertThat(stats.entries()).isEqualTo(2);
    assertThat(cache.contains(A)).isFalse();
  }

  @Test
  void imageLargerThanCacheIsReturnedButNotStored() {
    RenderCache cache = cache(100L, 10, Duration.ofHours(1), Duration.ofSeconds(10));
    RenderedImage huge = image(500);

    assertThat(cache.getOrRender(A, render(huge))).isSameAs(huge);

    assertThat(cache.contains(A)).isFalse();
    assertThat(cache.stats().totalBytes()).isZero();
  }

  @Test
  void expiredEntryIsRenderedAgain() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));

    cache.getOrRender(A, render(image(10)));
    clock.advance(Duration.ofMinutes(30));
    cache.getOrRender(A, render(image(10)));
    assertThat(renders.get()).isEqualTo(1);

    // Age counts from creation; the hit above does not extend the entry.
    clock.advance(Duration.ofMinutes(31));
    assertThat(cache.contains(A)).isFalse();
    cache.getOrRender(A, render(image(10)));

    assertThat(renders.get()).isEqualTo(2);
    assertThat(meterRegistry.get("seatview.cache.expirations.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void timeoutClearsInFlightSoTheNextCallRetries() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofMillis(100));
    CountDownLatch never = new CountDownLatch(1);

    try {
      assertThatThrownBy(() -> cache.getOrRender(A, blockingRender(never, image(10))))
          .isInstanceOf(RenderTimeoutException.class);
      assertThat(cache.stats().inFlight()).isZero();

      RenderedImage retried = image(12);
      assertThat(cache.getOrRender(A, render(retried))).isSameAs(retried);
      assertThat(renders.get()).isEqualTo(2);
    } finally {
      never.countDown();
    }
  }

  @Test
  void failureReachesEveryWaiterAndIsNotCached() throws Exception {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    CountDownLatch release = new CountDownLatch(1);
    RenderFatalException failure = new RenderFatalException("unknown template");
    Supplier<RenderedImage> failing = () -> {
      renders.incrementAndGet();
      await(release);
      throw failure;
    };

    CompletableFuture<RenderedImage> first = cache.getOrRenderAsync(A, failing);
    CompletableFuture<RenderedImage> second = cache.getOrRenderAsync(A, failing);
    release.countDown();

    assertThat(causeOf(first)).isSameAs(failure);
    assertThat(causeOf(second)).isSameAs(failure);
    assertThat(cache.stats().inFlight()).isZero();
    assertThat(cache.contains(A)).isFalse();

    assertThat(cache.getOrRender(A, render(image(5)))).isNotNull();
    assertThat(renders.get()).isEqualTo(2);
  }

  @Test
  void synchronousCallerReceivesRenderExceptionUnwrapped() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    RenderTransientException failure = new RenderTransientException("backend busy", 503);

    assertThatThrownBy(() -> cache.getOrRender(A, () -> {
      throw failure;
    })).isSameAs(failure);
  }

  @Test
  void nullImageIsTreatedAsFatal() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));

    assertThatThrownBy(() -> cache.getOrRender(A, () -> null)).isInstanceOf(RenderFatalException.class);
    assertThat(cache.stats().inFlight()).isZero();
  }

  @Test
  void unexpectedExceptionBecomesFatalRenderFailure() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));

    assertThatThrownBy(() -> cache.getOrRender(A, () -> {
      throw new IllegalStateException("boom");
    }))
        .isInstanceOf(RenderFatalException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectedRenderIsTransient() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    renderExecutor.shutdownNow();

    assertThatThrownBy(() -> cache.getOrRender(A, render(image(5)))).isInstanceOf(RenderTransientException.class);
    assertThat(cache.stats().inFlight()).isZero();
  }

  @Test
  void cancellingOneCallerLeavesTheSharedRenderRunning() throws Exception {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    CountDownLatch release = new CountDownLatch(1);
    RenderedImage image = image(10);

    CompletableFuture<RenderedImage> leaving = cache.getOrRenderAsync(A, blockingRender(release, image));
    CompletableFuture<RenderedImage> staying = cache.getOrRenderAsync(A, blockingRender(release, image));
    assertThat(leaving.cancel(true)).isTrue();
    release.countDown();

    assertThat(staying.get(5, TimeUnit.SECONDS)).isSameAs(image);
    assertThat(leaving.isCancelled()).isTrue();
    assertThat(cache.contains(A)).isTrue();
    assertThat(renders.get()).isEqualTo(1);
  }

  @Test
  void invalidateAndClearDropEntries() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    cache.getOrRender(A, render(image(10)));
    cache.getOrRender(B, render(image(20)));

    assertThat(cache.invalidate(A)).isTrue();
    assertThat(cache.invalidate(A)).isFalse();
    assertThat(cache.stats().totalBytes()).isEqualTo(20L);

    assertThat(cache.clear()).isEqualTo(1);
    assertThat(cache.stats().entries()).isZero();
    assertThat(cache.stats().totalBytes()).isZero();
  }

  @Test
  void renderFinishingAfterClearIsNotStored() throws Exception {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    CountDownLatch release = new CountDownLatch(1);
    RenderedImage stale = image(10);
    RenderedImage fresh = image(20);

    CompletableFuture<RenderedImage> before = cache.getOrRenderAsync(A, blockingRender(release, stale));
    assertThat(cache.clear()).isZero();
    assertThat(cache.stats().inFlight()).isZero();

    // A request after the clear does not join the detached render.
    assertThat(cache.getOrRender(A, render(fresh))).isSameAs(fresh);
    release.countDown();

    assertThat(before.get(5, TimeUnit.SECONDS)).isSameAs(stale);
    assertThat(cache.getOrRender(A, render(image(30)))).isSameAs(fresh);
    assertThat(cache.stats().totalBytes()).isEqualTo(20L);
    assertThat(renders.get()).isEqualTo(2);
  }

  @Test
  void gaugesReportOccupancy() {
    RenderCache cache = cache(1_000_000L, 100, Duration.ofHours(1), Duration.ofSeconds(10));
    cache.getOrRender(A, render(image(10)));

    assertThat(meterRegistry.get("seatview.cache.entries").gauge().value()).isEqualTo(1.0);
    assertThat(meterRegistry.get("seatview.cache.bytes").gauge().value()).isEqualTo(10.0);
  }

  @Test
  void settingsRejectNonPositiveBounds() {
    assertThatThrownBy(() -> new RenderCache.Settings(0L, 10, Duration.ofHours(1), Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RenderCache.Settings(10L, 10, Duration.ZERO, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private RenderCache cache(long maxBytes, int maxEntries, Duration ttl, Duration renderTimeout) {
    return new RenderCache(
        new RenderCache.Settings(maxBytes, maxEntries, ttl, renderTimeout), renderExecutor, clock, meterRegistry);
  }

  private Supplier<RenderedImage> render(RenderedImage image) {
    return () -> {
      renders.incrementAndGet();
      return image;
    };
  }

  private Supplier<RenderedImage> blockingRender(CountDownLatch release, RenderedImage image) {
    return () -> {
      renders.incrementAndGet();
      await(release);
      return image;
    };
  }

  private double lookups(String result) {
    return meterRegistry.get("seatview.cache.lookups.total").tag("result", result).counter().count();
  }

  private void awaitCount(String result, int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (lookups(result) < expected) {
      if (System.nanoTime() > deadline) {
        fail("expected " + expected + " " + result + " lookups, saw " + lookups(result));
      }
      Thread.sleep(5);
    }
  }

  private static Throwable causeOf(CompletableFuture<RenderedImage> future) throws InterruptedException {
    try {
      future.get(5, TimeUnit.SECONDS);
    } catch (ExecutionException ex) {
      return ex.getCause();
    } catch (TimeoutException ex) {
      fail("render did not complete");
    }
    return fail("render was expected to fail");
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static RenderedImage image(int size) {
    return new RenderedImage(new byte[size], RenderedImage.PNG);
  }

  private static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
