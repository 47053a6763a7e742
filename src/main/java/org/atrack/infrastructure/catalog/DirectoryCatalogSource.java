package org.atrack.infrastructure.catalog;

import org.atrack.application.port.CatalogSource;
import org.atrack.domain.Catalog;
import org.atrack.domain.ImageMetadata;
import org.atrack.domain.MasterCatalog;
import org.atrack.domain.SourceRecord;
import org.atrack.infrastructure.catalog.FrameManifestLoader.FrameManifest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CatalogSource} backed by a directory of text catalogs and a frame manifest.
 * <p><strong>Ordering:</strong> catalogs are indexed by ascending file name; {@code master.*} files are never treated
 * as images.</p>
 * <p><strong>Master:</strong> an explicit path wins, then a {@code master.*} file in the directory; otherwise
 * {@link #loadMaster()} is empty and the caller builds one.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryCatalogSource implements CatalogSource {
  private static final Logger log = LoggerFactory.getLogger(DirectoryCatalogSource.class);

  private final Path directory;
  private final Path manifest;
  private final Optional<Path> master;

  /**
   * Creates a source.
   *
   * @param directory catalog directory
   * @param manifest frame manifest path
   * @param master explicit master catalog, if configured
   */
  public DirectoryCatalogSource(Path directory, Path manifest, Optional<Path> master) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.manifest = Objects.requireNonNull(manifest, "manifest");
    this.master = Objects.requireNonNull(master, "master");
  }

  @Override
  public List<Catalog> loadCatalogs() throws IOException {
    List<Path> files = CatalogFiles.listImageCatalogs(directory);
    if (files.isEmpty()) {
      log.warn("No catalogs found in {}", directory);
      return List.of();
    }
    FrameManifest frames = FrameManifestLoader.load(manifest);
    List<Catalog> catalogs = new ArrayList<>(files.size());
    for (int index = 0; index < files.size(); index++) {
      Path file = files.get(index);
      String fileName = file.getFileName().toString();
      ImageMetadata metadata = frames.lookup(fileName)
          .orElseThrow(() -> new CatalogFormatException(
              "No frame metadata for " + fileName + " in " + manifest));
      List<SourceRecord> records = CatalogTextReader.read(file);
      log.debug("Loaded {} records from {} as image {}", records.size(), fileName, index);
      catalogs.add(new Catalog(index, CatalogFiles.stem(fileName), metadata, records));
    }
    log.info("Loaded {} catalogs from {}", catalogs.size(), directory);
    return catalogs;
  }

  @Override
  public Optional<MasterCatalog> loadMaster() throws IOException {
    Path path = master.orElse(null);
    if (path == null) {
      path = CatalogFiles.findMaster(directory);
    }
    if (path == null || !Files.isRegularFile(path)) {
      if (master.isPresent()) {
        throw new CatalogFormatException("Master catalog not found: " + master.get());
      }
      return Optional.empty();
    }
    List<SourceRecord> records = CatalogTextReader.read(path);
    log.info("Loaded master catalog {} with {} records", path.getFileName(), records.size());
    return Optional.of(new MasterCatalog(records));
  }
}
