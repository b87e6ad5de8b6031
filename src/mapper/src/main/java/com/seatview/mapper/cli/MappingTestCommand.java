package com.seatview.mapper.cli;

import com.seatview.mapper.camera.ClickPoint;
import com.seatview.mapper.camera.CoordinateMapper;
import com.seatview.mapper.camera.MappingResult;
import com.seatview.mapper.geometry.GeometryEngine;
import com.seatview.mapper.geometry.Point2D;
import com.seatview.mapper.venue.InvalidVenueConfigException;
import com.seatview.mapper.venue.Section;
import com.seatview.mapper.venue.VenueLoader;
import com.seatview.mapper.venue.VenueModel;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual verification entry point: maps sample clicks for one venue and prints the poses.
 *
 * <p>Usage: {@code MappingTestCommand <venuesDir> [venueId]}.
 */
public final class MappingTestCommand {
  private static final Logger log = LoggerFactory.getLogger(MappingTestCommand.class);
  private static final String DEFAULT_VENUE = "yankee_stadium";

  /** Fixed probes in normalized coordinates, on top of every section centroid. */
  private static final List<Sample> FIXED_SAMPLES = List.of(
      new Sample("Center behind home plate", 0.50, 0.75),
      new Sample("Third base side lower", 0.35, 0.62),
      new Sample("First base side lower", 0.65, 0.62),
      new Sample("Upper deck behind home", 0.50, 0.88),
      new Sample("Seatmap corner", 0.0, 0.0));

  private final CoordinateMapper mapper;
  private final PrintStream out;

  record Sample(String label, double x, double y) {}

  MappingTestCommand(CoordinateMapper mapper, PrintStream out) {
    this.mapper = mapper;
    this.out = out;
  }

  public static void main(String[] args) {
    if (args.length < 1) {
      System.err.println("usage: MappingTestCommand <venuesDir> [venueId]");
      System.exit(2);
    }
    Path venuesDir = Path.of(args[0]);
    String venueId = args.length > 1 ? args[1] : DEFAULT_VENUE;

    VenueModel venue;
    try {
      venue = new VenueLoader().load(venuesDir, venueId);
    } catch (InvalidVenueConfigException ex) {
      log.error("Cannot load venue {}: {}", venueId, ex.getMessage());
      System.exit(1);
      return;
    }
    new MappingTestCommand(new CoordinateMapper(), System.out).run(venue);
  }

  /** Prints one block per sample click and returns the number of samples mapped. */
  int run(VenueModel venue) {
    out.printf(Locale.ROOT, "Venue: %s (%s), type=%s, template=%s%n",
        venue.name(), venue.id(), venue.type().configValue(), venue.templateId());
    out.printf(Locale.ROOT, "Sections defined: %d%n", venue.sections().size());

    List<Sample> samples = new ArrayList<>();
    for (Section section : venue.sections()) {
      Point2D centroid = GeometryEngine.centroid(section.polygon());
      samples.add(new Sample("Centroid of section " + section.id(), centroid.x(), centroid.y()));
    }
    samples.addAll(FIXED_SAMPLES);

    for (Sample sample : samples) {
      MappingResult result = mapper.map(new ClickPoint(sample.x(), sample.y()), venue);
      out.printf(Locale.ROOT, "%n%s (%.3f, %.3f):%n", sample.label(), sample.x(), sample.y());
      out.printf(Locale.ROOT, "  Section: %s [%s]%n", result.sectionId(), result.resolution());
      out.printf(Locale.ROOT, "  Depth: %.3f  Lateral: %.3f  Distance: %.2f m  Angle: %.2f deg%n",
          result.depth(), result.lateral(), result.distance(), result.angleDegrees());
      out.printf(Locale.ROOT, "  Camera position: (%.2f, %.2f, %.2f)%n",
          result.pose().position().x(), result.pose().position().y(), result.pose().position().z());
      out.printf(Locale.ROOT, "  Camera rotation: (%.3f, %.3f, %.3f)  FOV: %.1f%n",
          result.pose().rotation().x(), result.pose().rotation().y(), result.pose().rotation().z(),
          result.pose().fov());
    }
    return samples.size();
  }
}
