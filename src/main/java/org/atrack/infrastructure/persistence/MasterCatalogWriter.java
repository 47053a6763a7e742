package org.atrack.infrastructure.persistence;

import org.atrack.domain.MasterCatalog;
import org.atrack.domain.SourceRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes a master catalog in the whitespace-separated catalog text format. */
public final class MasterCatalogWriter {
  private MasterCatalogWriter() {}

  /**
   * Writes the catalog, replacing any existing file.
   *
   * @param master master catalog
   * @param file target file
   * @throws IOException when writing fails
   */
  public static void write(MasterCatalog master, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
      out.write("# " + String.join(" ", SourceRecord.COLUMN_NAMES));
      out.newLine();
      for (SourceRecord record : master.records()) {
        out.write(CandidateCsvWriter.formatRow(record).replace(',', ' '));
        out.newLine();
      }
    }
  }
}
