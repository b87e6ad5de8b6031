package com.seatview.mapper.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.seatview.mapper.geometry.DepthAxis;
import com.seatview.mapper.geometry.Point2D;
import com.seatview.mapper.geometry.Point3D;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads venue configuration files into validated {@link VenueModel} instances.
 *
 * <p>Layout on disk: {@code <venuesDir>/<venueId>/config.yaml} with a top-level {@code venue}
 * object.
 */
public class VenueLoader {
  public static final String CONFIG_FILE = "config.yaml";

  private final ObjectMapper yamlMapper;

  public VenueLoader() {
    this(new ObjectMapper(new YAMLFactory()));
  }

  public VenueLoader(ObjectMapper yamlMapper) {
    this.yamlMapper = yamlMapper;
  }

  /**
   * Lists venue ids that have a configuration file under the given directory.
   *
   * @param venuesDir root directory of venue folders
   * @return sorted venue ids, empty when the directory does not exist
   */
  public List<String> discover(Path venuesDir) {
    if (!Files.isDirectory(venuesDir)) {
      return List.of();
    }
    try (Stream<Path> children = Files.list(venuesDir)) {
      return children
          .filter(dir -> Files.isRegularFile(dir.resolve(CONFIG_FILE)))
          .map(dir -> dir.getFileName().toString())
          .sorted()
          .toList();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to list venues in " + venuesDir, ex);
    }
  }

  /**
   * Loads and validates one venue.
   *
   * @param venuesDir root directory of venue folders
   * @param venueId venue folder name
   * @return validated venue
   * @throws InvalidVenueConfigException when the file is missing, unreadable or malformed
   */
  public VenueModel load(Path venuesDir, String venueId) {
    Path configPath = venuesDir.resolve(venueId).resolve(CONFIG_FILE);
    if (!Files.isRegularFile(configPath)) {
      throw new InvalidVenueConfigException("Venue config not found: " + configPath);
    }
    try (InputStream in = Files.newInputStream(configPath)) {
      return parse(in, configPath.toString());
    } catch (IOException ex) {
      throw new InvalidVenueConfigException("Failed to read venue config " + configPath, ex);
    }
  }

  /**
   * Parses and validates a venue document.
   *
   * @param in YAML (or JSON) document
   * @param origin description of the source, used in error messages
   * @return validated venue
   */
  public VenueModel parse(InputStream in, String origin) {
    JsonNode root;
    try {
      root = yamlMapper.readTree(in);
    } catch (IOException ex) {
      throw new InvalidVenueConfigException("Malformed venue document " + origin, ex);
    }
    JsonNode venue = root == null ? null : root.get("venue");
    if (venue == null || !venue.isObject()) {
      throw new InvalidVenueConfigException(origin + ": missing top-level 'venue' object");
    }

    String id = requiredText(venue, "id", origin);
    VenueModel model = new VenueModel(
        id,
        venue.path("name").asText(id),
        VenueType.fromConfig(venue.path("type").asText(null)),
        requiredText(venue, "template", origin),
        parseSeatmap(venue.get("seatmap"), origin),
        parseFieldCenter(venue.get("field_center")),
        parseTiers(venue.get("tiers"), origin),
        parseSections(venue.get("sections"), origin));
    return VenueValidator.validate(model);
  }

  private SeatmapConfig parseSeatmap(JsonNode node, String origin) {
    if (node == null || !node.isObject()) {
      throw new InvalidVenueConfigException(origin + ": missing 'seatmap'");
    }
    return new SeatmapConfig(
        node.path("file").asText(null),
        requiredInt(node, "width", origin),
        requiredInt(node, "height", origin));
  }

  private Point3D parseFieldCenter(JsonNode node) {
    if (node == null || node.isNull()) {
      return Point3D.ORIGIN;
    }
    return new Point3D(node.path("x").asDouble(0.0), node.path("y").asDouble(0.0), node.path("z").asDouble(0.0));
  }

  private List<Tier> parseTiers(JsonNode node, String origin) {
    if (node == null || !node.isObject() || node.isEmpty()) {
      throw new InvalidVenueConfigException(origin + ": missing 'tiers'");
    }
    List<Tier> tiers = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      int tierId;
      try {
        tierId = Integer.parseInt(field.getKey().trim());
      } catch (NumberFormatException ex) {
        throw new InvalidVenueConfigException(origin + ": tier key is not a number: " + field.getKey(), ex);
      }
      JsonNode tier = field.getValue();
      JsonNode range = tier.get("distance_range");
      if (range == null || !range.isArray() || range.size() != 2
          || !range.get(0).isNumber() || !range.get(1).isNumber()) {
        throw new InvalidVenueConfigException(origin + ": tier " + tierId + " needs distance_range [min, max]");
      }
      if (!tier.path("elevation").isNumber()) {
        throw new InvalidVenueConfigException(origin + ": tier " + tierId + " needs a numeric elevation");
      }
      tiers.add(new Tier(tierId, tier.get("elevation").asDouble(), range.get(0).asDouble(), range.get(1).asDouble()));
    }
    return tiers;
  }

  private List<Section> parseSections(JsonNode node, String origin) {
    if (node == null || !node.isArray()) {
      throw new InvalidVenueConfigException(origin + ": missing 'sections' list");
    }
    List<Section> sections = new ArrayList<>();
    for (JsonNode section : node) {
      String id = requiredText(section, "id", origin);
      String where = origin + ": section " + id;
      if (!section.path("tier").canConvertToInt()) {
        throw new InvalidVenueConfigException(where + " needs a numeric tier");
      }
      JsonNode rowCount = section.get("row_count");
      sections.add(new Section(
          id,
          section.get("tier").asInt(),
          parsePoints(section.get("polygon"), where + " polygon"),
          section.path("angle").asDouble(0.0),
          rowCount == null || rowCount.isNull() ? null : rowCount.asInt(),
          parseDepthAxis(section.get("depth_axis"), where)));
    }
    return sections;
  }

  private DepthAxis parseDepthAxis(JsonNode node, String where) {
    if (node == null || node.isNull()) {
      return null;
    }
    List<Point2D> front = parsePoints(node.get("front"), where + " depth_axis.front");
    List<Point2D> back = parsePoints(node.get("back"), where + " depth_axis.back");
    if (front.size() != 2 || back.size() != 2) {
      throw new InvalidVenueConfigException(where + " depth_axis edges need exactly 2 points each");
    }
    return new DepthAxis(front.get(0), front.get(1), back.get(0), back.get(1));
  }

  private List<Point2D> parsePoints(JsonNode node, String where) {
    if (node == null || !node.isArray()) {
      throw new InvalidVenueConfigException(where + " must be a list of [x, y] pairs");
    }
    List<Point2D> points = new ArrayList<>();
    for (JsonNode pair : node) {
      if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
        throw new InvalidVenueConfigException(where + " has a malformed vertex: " + pair);
      }
      points.add(new Point2D(pair.get(0).asDouble(), pair.get(1).asDouble()));
    }
    return points;
  }

  private static String requiredText(JsonNode node, String field, String origin) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      throw new InvalidVenueConfigException(origin + ": missing '" + field + "'");
    }
    return value.asText().trim();
  }

  private static int requiredInt(JsonNode node, String field, String origin) {
    JsonNode value = node.get(field);
    if (value == null || !value.canConvertToInt()) {
      throw new InvalidVenueConfigException(origin + ": missing integer '" + field + "'");
    }
    return value.asInt();
  }
}
