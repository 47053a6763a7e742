package org.atrack.application.port;

import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the per-image catalogs of a run and, when available, a prebuilt master catalog.
 *
 * @since 0.1.0
 */
public interface CatalogSource {
  /**
   * Loads every per-image catalog in time order, with image indices assigned from zero.
   *
   * @return catalogs ordered by image index
   * @throws IOException when a catalog or its metadata cannot be read or parsed
   */
  List<Catalog> loadCatalogs() throws IOException;

  /**
   * Loads the stacked master catalog if the source has one.
   *
   * @return master catalog, or empty when it must be built from the images
   * @throws IOException when the master file exists but cannot be read or parsed
   */
  Optional<MasterCatalog> loadMaster() throws IOException;
}
