package org.atrack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Stacked reference catalog used to separate stationary sources from transients.
 *
 * @param records reference records
 * @since 0.1.0
 */
public record MasterCatalog(List<SourceRecord> records) {

  public MasterCatalog {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  /**
   * Mean FWHM of all reference records.
   *
   * @return arithmetic mean, or {@link Double#NaN} when the catalog is empty
   */
  public double meanFwhm() {
    if (records.isEmpty()) {
      return Double.NaN;
    }
    double sum = 0;
    for (SourceRecord record : records) {
      sum += record.fwhm();
    }
    return sum / records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
