package org.atrack.infrastructure.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/** File naming rules for catalog directories. */
public final class CatalogFiles {
  /** Recognised catalog extensions. */
  public static final Set<String> EXTENSIONS = Set.of("cat", "pysexcat", "txt");
  /** File stem that marks the stacked master catalog. */
  public static final String MASTER_STEM = "master";

  private CatalogFiles() {}

  /**
   * Lists per-image catalogs sorted by file name, excluding the master catalog.
   *
   * @param directory catalog directory
   * @return sorted catalog paths
   * @throws IOException when the directory cannot be listed
   */
  public static List<Path> listImageCatalogs(Path directory) throws IOException {
    List<Path> catalogs = new ArrayList<>();
    try (Stream<Path> entries = Files.list(directory)) {
      entries.filter(Files::isRegularFile)
          .filter(path -> isCatalog(path) && !isMaster(path))
          .sorted(Comparator.comparing(path -> path.getFileName().toString()))
          .forEach(catalogs::add);
    }
    return catalogs;
  }

  /**
   * Finds a {@code master.<ext>} catalog inside the directory.
   *
   * @param directory catalog directory
   * @return master catalog path or {@code null} when absent
   * @throws IOException when the directory cannot be listed
   */
  public static Path findMaster(Path directory) throws IOException {
    try (Stream<Path> entries = Files.list(directory)) {
      return entries.filter(Files::isRegularFile)
          .filter(path -> isCatalog(path) && isMaster(path))
          .min(Comparator.comparing(path -> path.getFileName().toString()))
          .orElse(null);
    }
  }

  static boolean isCatalog(Path path) {
    return EXTENSIONS.contains(extension(path.getFileName().toString()));
  }

  static boolean isMaster(Path path) {
    return MASTER_STEM.equals(stem(path.getFileName().toString()).toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the file name without its last extension.
   *
   * @param fileName file name
   * @return stem
   */
  public static String stem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? fileName : fileName.substring(0, dot);
  }

  static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
