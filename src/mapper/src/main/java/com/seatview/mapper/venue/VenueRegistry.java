package com.seatview.mapper.venue;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe holder of the currently published venues.
 *
 * <p>Readers see an immutable snapshot. Updates build a new map and swap it in, so a mapping
 * request that already holds a {@link VenueModel} keeps working against it during a reload.
 */
public class VenueRegistry {
  private static final Logger log = LoggerFactory.getLogger(VenueRegistry.class);

  private final AtomicReference<Map<String, VenueModel>> venues = new AtomicReference<>(Map.of());

  /**
   * Outcome of a directory load.
   *
   * @param loaded ids of the venues now published
   * @param rejected ids of the venues that failed validation, with the reason
   */
  public record LoadReport(List<String> loaded, Map<String, String> rejected) {}

  public Optional<VenueModel> find(String venueId) {
    if (venueId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(venues.get().get(venueId));
  }

  public List<VenueModel> all() {
    return venues.get().values().stream()
        .sorted((left, right) -> left.id().compareTo(right.id()))
        .toList();
  }

  public int size() {
    return venues.get().size();
  }

  /**
   * Replaces every published venue with the given set.
   *
   * @param replacement venues to publish; each is validated first
   * @throws InvalidVenueConfigException when a venue is invalid or an id repeats
   */
  public void replaceAll(Collection<VenueModel> replacement) {
    Map<String, VenueModel> next = new LinkedHashMap<>();
    for (VenueModel venue : replacement) {
      VenueValidator.validate(venue);
      if (next.putIfAbsent(venue.id(), venue) != null) {
        throw new InvalidVenueConfigException("duplicate venue id " + venue.id());
      }
    }
    venues.set(Map.copyOf(next));
  }

  /** Publishes or replaces a single venue. */
  public void put(VenueModel venue) {
    VenueValidator.validate(venue);
    venues.updateAndGet(current -> {
      Map<String, VenueModel> next = new HashMap<>(current);
      next.put(venue.id(), venue);
      return Map.copyOf(next);
    });
  }

  /**
   * Loads every venue found under a directory and publishes the valid ones as a full replacement.
   *
   * <p>Invalid venues are logged and left out; they never reach the mapping path.
   *
   * @param loader venue file reader
   * @param venuesDir root directory of venue folders
   * @return loaded and rejected venue ids
   */
  public LoadReport loadDirectory(VenueLoader loader, Path venuesDir) {
    Map<String, VenueModel> loaded = new LinkedHashMap<>();
    Map<String, String> rejected = new LinkedHashMap<>();
    for (String venueId : loader.discover(venuesDir)) {
      try {
        VenueModel venue = loader.load(venuesDir, venueId);
        if (loaded.putIfAbsent(venue.id(), venue) != null) {
          rejected.put(venueId, "duplicate venue id " + venue.id());
          log.error("Skipping venue folder {}: duplicate venue id {}", venueId, venue.id());
        }
      } catch (InvalidVenueConfigException ex) {
        rejected.put(venueId, ex.getMessage());
        log.error("Skipping invalid venue {}: {}", venueId, ex.getMessage());
      }
    }
    venues.set(Map.copyOf(loaded));
    log.info("Venues loaded from {}: loaded={}, rejected={}", venuesDir, loaded.keySet(), rejected.keySet());
    return new LoadReport(List.copyOf(loaded.keySet()), Map.copyOf(rejected));
  }
}
