package org.atrack.testutil;

import org.atrack.config.DetectionConfig;
import org.atrack.domain.Candidate;
import org.atrack.domain.Catalog;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.ImageMetadata;
import org.atrack.domain.SourceRecord;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for sky fixtures. Positions are in degrees; moving objects are laid out along RA at
 * {@code dec = 0} so projected distances equal RA offsets.
 */
public final class Fixtures {
  public static final Instant START = Instant.parse("2021-03-04T01:00:00Z");
  public static final double EXPOSURE_SECONDS = 60.0;
  public static final double ARCSEC = 1.0 / 3600.0;
  private static final DateTimeFormatter TIME_OBS = DateTimeFormatter.ofPattern("HH:mm:ss");

  private Fixtures() {}

  /** A source that passes every default quality cut at pixel (500, 500). */
  public static SourceRecord star(double ra, double dec) {
    return star(500.0, 500.0, ra, dec);
  }

  public static SourceRecord star(double x, double y, double ra, double dec) {
    return new SourceRecord(0, x, y, ra, dec, 1_000.0, 10.0, 10.0, 15.0, 0.01, 2.0, 1.1);
  }

  public static Candidate candidate(int image, double ra, double dec) {
    return new Candidate(image, star(ra, dec));
  }

  /** Exposure starting {@code offsetSeconds} after {@link #START}, 60 s long, unbinned. */
  public static ImageMetadata frameAt(double offsetSeconds) {
    return ImageMetadata.unbinned(START.plusMillis(Math.round(offsetSeconds * 1000)), EXPOSURE_SECONDS);
  }

  public static Catalog catalog(int image, double offsetSeconds, SourceRecord... records) {
    return new Catalog(image, String.format("img-%03d", image), frameAt(offsetSeconds), Arrays.asList(records));
  }

  public static ImageCandidates imageCandidates(int image, double offsetSeconds, Candidate... candidates) {
    return new ImageCandidates(
        image, String.format("img-%03d", image), frameAt(offsetSeconds), Arrays.asList(candidates));
  }

  /** Defaults with selected keys overridden. */
  public static DetectionConfig config(String... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("key/value pairs expected");
    }
    Map<String, String> options = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      options.put(keyValues[i], keyValues[i + 1]);
    }
    return DetectionConfig.fromMap(options);
  }

  /**
   * Four frames 600 s apart. Each holds two fixed stars and one object moving {@code stepArcsec} along RA per
   * frame, starting at RA 150.
   */
  public static List<Catalog> movingObjectSequence(double stepArcsec) {
    List<Catalog> catalogs = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      catalogs.add(catalog(i, 600.0 * i,
          star(100.0, 100.0, 150.2, 0.1),
          star(900.0, 900.0, 149.8, -0.1),
          star(300.0 + i, 300.0, 150.0 + i * stepArcsec * ARCSEC, 0.0)));
    }
    return catalogs;
  }

  /**
   * Writes catalogs as {@code <name>.cat} files plus a {@code frames.yaml} manifest describing them.
   *
   * @return the directory
   */
  public static Path writeCatalogDirectory(Path directory, List<Catalog> catalogs) throws IOException {
    Files.createDirectories(directory);
    StringBuilder manifest = new StringBuilder("frames:\n");
    for (Catalog catalog : catalogs) {
      try (Writer out = Files.newBufferedWriter(directory.resolve(catalog.name() + ".cat"), StandardCharsets.US_ASCII)) {
        out.write("# flag x y ra dec flux fluxErr background mag magErr fwhm elongation\n");
        for (SourceRecord record : catalog.records()) {
          StringBuilder row = new StringBuilder().append(record.flag());
          double[] columns = record.toColumns();
          for (int i = 1; i < columns.length; i++) {
            row.append(' ').append(columns[i]);
          }
          out.write(row.append('\n').toString());
        }
      }
      LocalDateTime start = LocalDateTime.ofInstant(catalog.metadata().timestamp(), ZoneOffset.UTC);
      manifest.append("  ").append(catalog.name()).append(":\n")
          .append("    date-obs: ").append(start.toLocalDate()).append('\n')
          .append("    time-obs: '").append(TIME_OBS.format(start)).append("'\n")
          .append("    exptime: ").append(catalog.metadata().exposureSeconds()).append('\n');
    }
    Files.writeString(directory.resolve("frames.yaml"), manifest.toString());
    return directory;
  }
}
