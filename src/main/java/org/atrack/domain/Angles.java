package org.atrack.domain;

/**
 * Unit conversions between degrees, arcseconds and radians.
 */
public final class Angles {
  private static final double ARCSEC_PER_DEGREE = 3600.0;

  private Angles() {
    // Utility
  }

  public static double degreesToRadians(double degrees) {
    return degrees * Math.PI / 180.0;
  }

  public static double arcsecToRadians(double arcsec) {
    return degreesToRadians(arcsec / ARCSEC_PER_DEGREE);
  }

  public static double radiansToArcsec(double radians) {
    return radians * ARCSEC_PER_DEGREE * 180.0 / Math.PI;
  }
}
