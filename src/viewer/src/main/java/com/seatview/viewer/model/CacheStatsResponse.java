package com.seatview.viewer.model;

import com.seatview.viewer.cache.CacheStats;

/**
 * Render cache statistics payload.
 *
 * @param entries stored renders
 * @param totalBytes bytes held by stored renders
 * @param inFlight renders currently running
 * @param maxEntries configured entry bound
 * @param maxBytes configured byte bound
 */
public record CacheStatsResponse(int entries, long totalBytes, int inFlight, int maxEntries, long maxBytes) {
  public static CacheStatsResponse from(CacheStats stats) {
    return new CacheStatsResponse(
        stats.entries(), stats.totalBytes(), stats.inFlight(), stats.maxEntries(), stats.maxBytes());
  }
}
