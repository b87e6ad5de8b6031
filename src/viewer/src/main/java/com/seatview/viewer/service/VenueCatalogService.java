package com.seatview.viewer.service;

import com.seatview.mapper.venue.VenueLoader;
import com.seatview.mapper.venue.VenueModel;
import com.seatview.mapper.venue.VenueRegistry;
import com.seatview.viewer.api.NotFoundException;
import com.seatview.viewer.config.ViewerProperties;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Loads venue configurations from the configured directory and serves them by id.
 */
@Service
public class VenueCatalogService {
  private final VenueLoader loader;
  private final VenueRegistry registry;
  private final Path venuesDir;

  public VenueCatalogService(VenueLoader loader, VenueRegistry registry, ViewerProperties properties) {
    this.loader = loader;
    this.registry = registry;
    this.venuesDir = Path.of(properties.getVenues().getDir());
  }

  @PostConstruct
  void loadOnStartup() {
    reload();
  }

  /**
   * Re-reads the venue directory and replaces the served set in one step.
   *
   * @return loaded and rejected venue ids
   */
  public VenueRegistry.LoadReport reload() {
    return registry.loadDirectory(loader, venuesDir);
  }

  public List<VenueModel> venues() {
    return registry.all();
  }

  /**
   * Returns a loaded venue.
   *
   * @param venueId venue identifier
   * @return venue
   * @throws NotFoundException when no valid venue has this id
   */
  public VenueModel venue(String venueId) {
    return registry.find(venueId)
        .orElseThrow(() -> new NotFoundException("venue not found: " + venueId));
  }
}
