package org.atrack.infrastructure.persistence;

import org.atrack.application.port.CandidateSink;
import org.atrack.domain.Candidate;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.SourceRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each image's candidates to {@code <dir>/<name>.cnd} as CSV with a header row of catalog column names.
 * <p>Safe for concurrent calls on different images.</p>
 *
 * @since 0.1.0
 */
public final class CandidateCsvWriter implements CandidateSink {
  private static final Logger log = LoggerFactory.getLogger(CandidateCsvWriter.class);
  static final String EXTENSION = ".cnd";
  static final String HEADER = String.join(",", SourceRecord.COLUMN_NAMES);

  private final Path directory;

  public CandidateCsvWriter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public void write(ImageCandidates image) throws IOException {
    Files.createDirectories(directory);
    Path file = directory.resolve(image.name() + EXTENSION);
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      out.write(HEADER);
      out.newLine();
      for (Candidate candidate : image.candidates()) {
        out.write(formatRow(candidate.record()));
        out.newLine();
      }
    }
    log.debug("Wrote {} candidates to {}", image.candidates().size(), file.getFileName());
  }

  static String formatRow(SourceRecord record) {
    StringBuilder row = new StringBuilder(160);
    row.append(record.flag());
    double[] columns = record.toColumns();
    for (int i = 1; i < columns.length; i++) {
      row.append(',').append(columns[i]);
    }
    return row.toString();
  }
}
