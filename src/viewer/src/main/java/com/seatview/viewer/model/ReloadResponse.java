package com.seatview.viewer.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a venue directory reload.
 *
 * @param loaded venue ids now being served
 * @param rejected invalid venue folders with the reason they were skipped
 * @param clearedCacheEntries cached renders dropped by the reload
 */
public record ReloadResponse(List<String> loaded, Map<String, String> rejected, int clearedCacheEntries) {}
