package org.atrack.domain;

import java.util.Objects;

/**
 * <strong>What:</strong> Small-angle planar geometry on (ra, dec) positions.
 * <p><strong>Why:</strong> Every detection stage compares positions through the same projection, so distances
 * stay consistent between candidate filtering, segment search and speed measurement.</p>
 * <p><strong>Projection:</strong> each point is mapped to {@code x = ra * cos(dec)}, {@code y = dec} in radians
 * using that point's own declination. The distance is therefore not symmetric in general:
 * {@code angularDistance(p, q)} and {@code angularDistance(q, p)} agree only up to the order of floating-point
 * operations, and callers pass points in a fixed order.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SkyGeometry {

  private SkyGeometry() {
    // Utility
  }

  /**
   * Planar angular distance between two positions given in degrees.
   *
   * @param ra1 right ascension of the first point, degrees
   * @param dec1 declination of the first point, degrees
   * @param ra2 right ascension of the second point, degrees
   * @param dec2 declination of the second point, degrees
   * @return distance in radians
   */
  public static double angularDistance(double ra1, double dec1, double ra2, double dec2) {
    double dec1r = Angles.degreesToRadians(dec1);
    double dec2r = Angles.degreesToRadians(dec2);
    double x1 = Angles.degreesToRadians(ra1) * Math.cos(dec1r);
    double x2 = Angles.degreesToRadians(ra2) * Math.cos(dec2r);
    double dx = x2 - x1;
    double dy = dec2r - dec1r;
    return Math.sqrt(dx * dx + dy * dy);
  }

  /**
   * Planar angular distance between two candidates.
   *
   * @param p1 first point
   * @param p2 second point
   * @return distance in radians
   */
  public static double angularDistance(Candidate p1, Candidate p2) {
    return angularDistance(p1.ra(), p1.dec(), p2.ra(), p2.dec());
  }

  /**
   * Planar angular distance between two source records.
   *
   * @param p1 first record
   * @param p2 second record
   * @return distance in radians
   */
  public static double angularDistance(SourceRecord p1, SourceRecord p2) {
    return angularDistance(p1.ra(), p1.dec(), p2.ra(), p2.dec());
  }

  /**
   * Tests whether two candidates lie within {@code maxDistance} of each other. The bound is inclusive.
   *
   * @param p1 first point
   * @param p2 second point
   * @param maxDistance bound in radians
   * @return {@code true} when {@code angularDistance(p1, p2) <= maxDistance}
   */
  public static boolean isWithin(Candidate p1, Candidate p2, double maxDistance) {
    return angularDistance(p1, p2) <= maxDistance;
  }

  /**
   * Tests whether two records lie within {@code maxDistance} of each other. The bound is inclusive.
   *
   * @param p1 first record
   * @param p2 second record
   * @param maxDistance bound in radians
   * @return {@code true} when {@code angularDistance(p1, p2) <= maxDistance}
   */
  public static boolean isWithin(SourceRecord p1, SourceRecord p2, double maxDistance) {
    return angularDistance(p1, p2) <= maxDistance;
  }

  /**
   * Reorders a triangle so the two ends of its longest edge come first.
   *
   * <p>Ties resolve in evaluation order: edge 1-2, then 1-3, then 2-3.</p>
   *
   * @param p1 first point
   * @param p2 second point
   * @param p3 third point
   * @return {@code (p1,p2,p3)}, {@code (p1,p3,p2)} or {@code (p2,p3,p1)}
   */
  public static Triangle longestEdgeOrder(Candidate p1, Candidate p2, Candidate p3) {
    double d12 = angularDistance(p1, p2);
    double d13 = angularDistance(p1, p3);
    double d23 = angularDistance(p2, p3);
    double longest = Math.max(d12, Math.max(d13, d23));
    if (longest == d12) {
      return new Triangle(p1, p2, p3);
    }
    if (longest == d13) {
      return new Triangle(p1, p3, p2);
    }
    return new Triangle(p2, p3, p1);
  }

  /**
   * Distance from {@code c} to the infinite line through {@code a} and {@code b} in projected coordinates.
   *
   * @param a first point on the line
   * @param b second point on the line
   * @param c point to measure
   * @return distance in radians; 0 when {@code a} and {@code b} project to the same point
   */
  public static double pointLineDistance(Candidate a, Candidate b, Candidate c) {
    double x1 = projectX(a);
    double y1 = Angles.degreesToRadians(a.dec());
    double x2 = projectX(b);
    double y2 = Angles.degreesToRadians(b.dec());
    double x3 = projectX(c);
    double y3 = Angles.degreesToRadians(c.dec());

    double norm = Math.sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1));
    if (norm == 0.0) {
      return 0.0;
    }
    return Math.abs((x2 - x1) * y3 - (y2 - y1) * x3 + x1 * y2 - x2 * y1) / norm;
  }

  private static double projectX(Candidate p) {
    return Angles.degreesToRadians(p.ra()) * Math.cos(Angles.degreesToRadians(p.dec()));
  }

  /**
   * Three points reordered by {@link #longestEdgeOrder}.
   *
   * @param first one end of the longest edge
   * @param second other end of the longest edge
   * @param third remaining point
   */
  public record Triangle(Candidate first, Candidate second, Candidate third) {
    public Triangle {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(second, "second");
      Objects.requireNonNull(third, "third");
    }
  }
}
