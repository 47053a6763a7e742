package org.atrack.domain;

/**
 * <strong>What:</strong> One detected point source from a per-image extraction catalog.
 * <p><strong>Why:</strong> Carries every measurement the candidate filter and track output need, in catalog column order.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param flag sum of extraction flags
 * @param x pixel x coordinate
 * @param y pixel y coordinate
 * @param ra right ascension in degrees
 * @param dec declination in degrees
 * @param flux integrated flux
 * @param fluxErr flux uncertainty
 * @param background local background level
 * @param mag instrumental magnitude
 * @param magErr magnitude uncertainty
 * @param fwhm full width at half maximum in pixels
 * @param elongation major/minor axis ratio
 * @since 0.1.0
 */
public record SourceRecord(
    int flag,
    double x,
    double y,
    double ra,
    double dec,
    double flux,
    double fluxErr,
    double background,
    double mag,
    double magErr,
    double fwhm,
    double elongation) {

  /** Number of columns a catalog row carries. */
  public static final int COLUMN_COUNT = 12;

  /** Column names in catalog order, used for candidate file headers. */
  public static final String[] COLUMN_NAMES = {
    "flag", "x", "y", "ra", "dec", "flux", "fluxErr", "background", "mag", "magErr", "fwhm", "elongation"
  };

  /**
   * Builds a record from the twelve numeric catalog columns.
   *
   * @param columns parsed values in catalog order
   * @return record
   * @throws IllegalArgumentException when the column count is wrong
   */
  public static SourceRecord fromColumns(double[] columns) {
    if (columns == null || columns.length != COLUMN_COUNT) {
      throw new IllegalArgumentException(
          "source record requires " + COLUMN_COUNT + " columns (was "
              + (columns == null ? 0 : columns.length) + ")");
    }
    return new SourceRecord(
        (int) columns[0],
        columns[1],
        columns[2],
        columns[3],
        columns[4],
        columns[5],
        columns[6],
        columns[7],
        columns[8],
        columns[9],
        columns[10],
        columns[11]);
  }

  /**
   * Returns the values in catalog column order.
   *
   * @return fresh array of twelve values
   */
  public double[] toColumns() {
    return new double[] {flag, x, y, ra, dec, flux, fluxErr, background, mag, magErr, fwhm, elongation};
  }

  /**
   * Signal-to-noise ratio derived from flux and flux error.
   *
   * @return {@code flux / fluxErr}; infinite or NaN when {@code fluxErr} is zero
   */
  public double snr() {
    return flux / fluxErr;
  }
}
