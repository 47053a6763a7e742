package org.atrack.application.pipeline;

import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import org.atrack.domain.SourceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the master catalog as the union of every per-image catalog, in image order.
 *
 * <p>Used when no stacked master is supplied. A stationary star then appears once per image and fails the
 * transience test, while a moving object matches at most its own detection.</p>
 *
 * @since 0.1.0
 */
public final class MasterCatalogBuilder {

  private MasterCatalogBuilder() {}

  /**
   * Concatenates the records of all catalogs.
   *
   * @param catalogs catalogs in image order
   * @return master catalog
   */
  public static MasterCatalog union(List<Catalog> catalogs) {
    Objects.requireNonNull(catalogs, "catalogs");
    List<SourceRecord> records = new ArrayList<>();
    for (Catalog catalog : catalogs) {
      records.addAll(catalog.records());
    }
    return new MasterCatalog(records);
  }
}
