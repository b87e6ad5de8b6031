package com.seatview.mapper.venue;

import com.seatview.mapper.geometry.Point3D;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory venue: geometry of the seating bowl plus the render template to use.
 *
 * <p>Instances are built once per load and never mutated; a reload publishes a new instance.
 * Structural checks live in {@link VenueValidator}.
 *
 * @param id venue identifier, for example {@code yankee_stadium}
 * @param name display name
 * @param type venue type
 * @param templateId render template reference
 * @param seatmap seatmap image description
 * @param fieldCenter point every seat looks toward, in meters
 * @param tiers tiers, sorted by id
 * @param sections sections, in declaration order
 */
public record VenueModel(
    String id,
    String name,
    VenueType type,
    String templateId,
    SeatmapConfig seatmap,
    Point3D fieldCenter,
    List<Tier> tiers,
    List<Section> sections) {

  public VenueModel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    fieldCenter = fieldCenter == null ? Point3D.ORIGIN : fieldCenter;
    tiers = Objects.requireNonNull(tiers, "tiers").stream()
        .sorted(Comparator.comparingInt(Tier::id))
        .toList();
    sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
  }

  public Optional<Tier> tier(int tierId) {
    for (Tier tier : tiers) {
      if (tier.id() == tierId) {
        return Optional.of(tier);
      }
    }
    return Optional.empty();
  }

  public Optional<Section> section(String sectionId) {
    for (Section section : sections) {
      if (section.id().equals(sectionId)) {
        return Optional.of(section);
      }
    }
    return Optional.empty();
  }
}
