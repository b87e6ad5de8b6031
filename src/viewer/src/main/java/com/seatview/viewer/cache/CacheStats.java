package com.seatview.viewer.cache;

/**
 * Point-in-time view of the render cache.
 *
 * @param entries stored renders
 * @param totalBytes bytes held by stored renders
 * @param inFlight renders currently running
 * @param maxEntries configured entry bound
 * @param maxBytes configured byte bound
 */
public record CacheStats(int entries, long totalBytes, int inFlight, int maxEntries, long maxBytes) {}
