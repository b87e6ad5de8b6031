package com.seatview.mapper.geometry;

import com.seatview.mapper.venue.Section;
import com.seatview.mapper.venue.SectionIds;
import java.util.List;

/**
 * Stateless geometry helpers over normalized seatmap coordinates.
 *
 * <p>Every method is a pure function of its arguments, so the camera poses built on top of them
 * are reproducible and can be used as cache keys.
 */
public final class GeometryEngine {
  static final double EPSILON = 1e-9;

  /** Seatmap position of the field; sections face it. */
  public static final Point2D SEATMAP_CENTER = new Point2D(0.5, 0.5);

  private GeometryEngine() {}

  /**
   * Tests whether a point lies inside a polygon using ray casting.
   *
   * <p>Points on an edge or a vertex count as inside, so clicks on a section border never miss.
   *
   * @param point normalized click point
   * @param polygon implicitly closed vertex list
   * @return {@code true} when the point is inside or on the boundary
   */
  public static boolean pointInPolygon(Point2D point, List<Point2D> polygon) {
    int n = polygon.size();
    if (n < 3) {
      return false;
    }
    for (int i = 0, j = n - 1; i < n; j = i++) {
      if (distanceToSegment(point, polygon.get(j), polygon.get(i)) <= EPSILON) {
        return true;
      }
    }

    boolean inside = false;
    for (int i = 0, j = n - 1; i < n; j = i++) {
      Point2D a = polygon.get(i);
      Point2D b = polygon.get(j);
      if ((a.y() > point.y()) != (b.y() > point.y())
          && point.x() < (b.x() - a.x()) * (point.y() - a.y()) / (b.y() - a.y()) + a.x()) {
        inside = !inside;
      }
    }
    return inside;
  }

  /**
   * Computes the area-weighted centroid of a polygon, falling back to the vertex mean for
   * polygons with no area.
   */
  public static Point2D centroid(List<Point2D> polygon) {
    if (polygon.isEmpty()) {
      throw new IllegalArgumentException("polygon has no vertices");
    }
    double area = signedArea(polygon);
    if (Math.abs(area) < EPSILON) {
      return vertexMean(polygon);
    }

    double cx = 0.0;
    double cy = 0.0;
    int n = polygon.size();
    for (int i = 0; i < n; i++) {
      Point2D a = polygon.get(i);
      Point2D b = polygon.get((i + 1) % n);
      double cross = a.x() * b.y() - b.x() * a.y();
      cx += (a.x() + b.x()) * cross;
      cy += (a.y() + b.y()) * cross;
    }
    return new Point2D(cx / (6.0 * area), cy / (6.0 * area));
  }

  /**
   * Finds the section whose centroid is closest to the point.
   *
   * <p>Equal distances resolve to the lowest section identifier.
   *
   * @param point normalized click point
   * @param sections candidate sections, at least one
   * @return closest section and its centroid distance
   */
  public static NearestSection nearestSection(Point2D point, List<Section> sections) {
    if (sections.isEmpty()) {
      throw new IllegalArgumentException("no sections to search");
    }
    Section best = null;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (Section section : sections) {
      double distance = point.distanceTo(centroid(section.polygon()));
      if (best == null
          || distance < bestDistance
          || (distance == bestDistance && SectionIds.ORDER.compare(section.id(), best.id()) < 0)) {
        best = section;
        bestDistance = distance;
      }
    }
    return new NearestSection(best.id(), bestDistance);
  }

  /**
   * Projects a point onto the depth axis of its section: 0 at the front row, 1 at the back row.
   *
   * <p>Without an explicit axis, depth runs along the bounding-box axis closest to the line from
   * {@link #SEATMAP_CENTER} to the section centroid, with 0 on the edge nearest the field.
   *
   * @param point normalized click point
   * @param polygon section polygon
   * @param axis explicit front/back edges, or {@code null}
   * @return depth fraction clamped to {@code [0, 1]}
   */
  public static double interpolateDepth(Point2D point, List<Point2D> polygon, DepthAxis axis) {
    if (axis != null && axis.length() > EPSILON) {
      return projectOnto(point, axis.frontMid(), axis.backMid());
    }
    Bounds bounds = Bounds.of(polygon);
    Point2D outward = outwardFromField(polygon);
    if (Math.abs(outward.x()) >= Math.abs(outward.y())) {
      double fraction = fraction(point.x(), bounds.minX(), bounds.maxX());
      return outward.x() >= 0.0 ? fraction : 1.0 - fraction;
    }
    double fraction = fraction(point.y(), bounds.minY(), bounds.maxY());
    return outward.y() >= 0.0 ? fraction : 1.0 - fraction;
  }

  /**
   * Projects a point onto the axis perpendicular to the depth axis, normalized over the polygon's
   * extent along that axis. A click on the middle line of a symmetric section gives 0.5.
   *
   * <p>The lateral direction is the depth direction turned a quarter turn, so for a section below
   * the field it grows with x, and it keeps the same sense of rotation around the whole bowl.
   */
  public static double interpolateLateral(Point2D point, List<Point2D> polygon, DepthAxis axis) {
    if (axis != null && axis.length() > EPSILON) {
      Point2D front = axis.frontMid();
      Point2D back = axis.backMid();
      return extentFraction(point, polygon, back.y() - front.y(), front.x() - back.x());
    }
    Bounds bounds = Bounds.of(polygon);
    Point2D outward = outwardFromField(polygon);
    if (Math.abs(outward.x()) >= Math.abs(outward.y())) {
      double fraction = fraction(point.y(), bounds.minY(), bounds.maxY());
      return outward.x() >= 0.0 ? 1.0 - fraction : fraction;
    }
    double fraction = fraction(point.x(), bounds.minX(), bounds.maxX());
    return outward.y() >= 0.0 ? fraction : 1.0 - fraction;
  }

  /** Shoelace area; positive for counter-clockwise vertex order in a y-up frame. */
  public static double signedArea(List<Point2D> polygon) {
    int n = polygon.size();
    double sum = 0.0;
    for (int i = 0; i < n; i++) {
      Point2D a = polygon.get(i);
      Point2D b = polygon.get((i + 1) % n);
      sum += a.x() * b.y() - b.x() * a.y();
    }
    return sum / 2.0;
  }

  /**
   * Checks that no two non-adjacent edges of the polygon touch or cross.
   *
   * @param polygon implicitly closed vertex list
   * @return {@code true} for a simple polygon
   */
  public static boolean isSimple(List<Point2D> polygon) {
    int n = polygon.size();
    if (n < 3) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      Point2D a1 = polygon.get(i);
      Point2D a2 = polygon.get((i + 1) % n);
      for (int j = i + 1; j < n; j++) {
        boolean adjacent = j == i + 1 || (i == 0 && j == n - 1);
        if (adjacent) {
          continue;
        }
        if (segmentsIntersect(a1, a2, polygon.get(j), polygon.get((j + 1) % n))) {
          return false;
        }
      }
    }
    return true;
  }

  public static double distanceToSegment(Point2D point, Point2D a, Point2D b) {
    double dx = b.x() - a.x();
    double dy = b.y() - a.y();
    double lengthSq = dx * dx + dy * dy;
    if (lengthSq == 0.0) {
      return point.distanceTo(a);
    }
    double t = clamp(((point.x() - a.x()) * dx + (point.y() - a.y()) * dy) / lengthSq, 0.0, 1.0);
    double px = a.x() + t * dx;
    double py = a.y() + t * dy;
    double ex = point.x() - px;
    double ey = point.y() - py;
    return Math.sqrt(ex * ex + ey * ey);
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  // Direction from the field to the section; a section centred on the field reads left to right.
  private static Point2D outwardFromField(List<Point2D> polygon) {
    Point2D centroid = centroid(polygon);
    return new Point2D(centroid.x() - SEATMAP_CENTER.x(), centroid.y() - SEATMAP_CENTER.y());
  }

  private static double projectOnto(Point2D point, Point2D from, Point2D to) {
    double dx = to.x() - from.x();
    double dy = to.y() - from.y();
    double lengthSq = dx * dx + dy * dy;
    double t = ((point.x() - from.x()) * dx + (point.y() - from.y()) * dy) / lengthSq;
    return clamp(t, 0.0, 1.0);
  }

  private static double extentFraction(Point2D point, List<Point2D> polygon, double dirX, double dirY) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Point2D vertex : polygon) {
      double projected = vertex.x() * dirX + vertex.y() * dirY;
      min = Math.min(min, projected);
      max = Math.max(max, projected);
    }
    return fraction(point.x() * dirX + point.y() * dirY, min, max);
  }

  private static double fraction(double value, double min, double max) {
    double span = max - min;
    if (span <= EPSILON) {
      return 0.5;
    }
    return clamp((value - min) / span, 0.0, 1.0);
  }

  private static Point2D vertexMean(List<Point2D> polygon) {
    double sx = 0.0;
    double sy = 0.0;
    for (Point2D p : polygon) {
      sx += p.x();
      sy += p.y();
    }
    return new Point2D(sx / polygon.size(), sy / polygon.size());
  }

  private static boolean segmentsIntersect(Point2D p1, Point2D p2, Point2D q1, Point2D q2) {
    double d1 = orientation(q1, q2, p1);
    double d2 = orientation(q1, q2, p2);
    double d3 = orientation(p1, p2, q1);
    double d4 = orientation(p1, p2, q2);
    if (((d1 > EPSILON && d2 < -EPSILON) || (d1 < -EPSILON && d2 > EPSILON))
        && ((d3 > EPSILON && d4 < -EPSILON) || (d3 < -EPSILON && d4 > EPSILON))) {
      return true;
    }
    return (Math.abs(d1) <= EPSILON && withinBox(q1, q2, p1))
        || (Math.abs(d2) <= EPSILON && withinBox(q1, q2, p2))
        || (Math.abs(d3) <= EPSILON && withinBox(p1, p2, q1))
        || (Math.abs(d4) <= EPSILON && withinBox(p1, p2, q2));
  }

  private static double orientation(Point2D a, Point2D b, Point2D c) {
    return (b.x() - a.x()) * (c.y() - a.y()) - (b.y() - a.y()) * (c.x() - a.x());
  }

  private static boolean withinBox(Point2D a, Point2D b, Point2D p) {
    return p.x() >= Math.min(a.x(), b.x()) - EPSILON
        && p.x() <= Math.max(a.x(), b.x()) + EPSILON
        && p.y() >= Math.min(a.y(), b.y()) - EPSILON
        && p.y() <= Math.max(a.y(), b.y()) + EPSILON;
  }

  private record Bounds(double minX, double minY, double maxX, double maxY) {
    static Bounds of(List<Point2D> polygon) {
      double minX = Double.POSITIVE_INFINITY;
      double minY = Double.POSITIVE_INFINITY;
      double maxX = Double.NEGATIVE_INFINITY;
      double maxY = Double.NEGATIVE_INFINITY;
      for (Point2D p : polygon) {
        minX = Math.min(minX, p.x());
        minY = Math.min(minY, p.y());
        maxX = Math.max(maxX, p.x());
        maxY = Math.max(maxY, p.y());
      }
      return new Bounds(minX, minY, maxX, maxY);
    }

    double width() {
      return maxX - minX;
    }

    double height() {
      return maxY - minY;
    }
  }
}
