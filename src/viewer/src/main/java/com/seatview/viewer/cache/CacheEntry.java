package com.seatview.viewer.cache;

import com.seatview.mapper.camera.Fingerprint;
import com.seatview.viewer.render.RenderedImage;
import java.time.Instant;

/** Stored render. Mutable state is guarded by the owning cache's lock. */
final class CacheEntry {
  private final Fingerprint fingerprint;
  private final RenderedImage image;
  private final Instant createdAt;
  private final long sizeBytes;
  private Instant lastAccessAt;

  CacheEntry(Fingerprint fingerprint, RenderedImage image, Instant createdAt) {
    this.fingerprint = fingerprint;
    this.image = image;
    this.createdAt = createdAt;
    this.lastAccessAt = createdAt;
    this.sizeBytes = image.sizeBytes();
  }

  Fingerprint fingerprint() {
    return fingerprint;
  }

  RenderedImage image() {
    return image;
  }

  Instant createdAt() {
    return createdAt;
  }

  Instant lastAccessAt() {
    return lastAccessAt;
  }

  long sizeBytes() {
    return sizeBytes;
  }

  void touch(Instant now) {
    lastAccessAt = now;
  }
}
