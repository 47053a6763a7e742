package org.atrack.infrastructure.catalog;

import org.atrack.domain.SourceRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads whitespace-separated source catalogs with twelve numeric columns per row.
 *
 * <p>Columns follow {@link SourceRecord} order. Blank lines and lines starting with {@code #} are skipped.</p>
 *
 * @since 0.1.0
 */
public final class CatalogTextReader {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private CatalogTextReader() {}

  /**
   * Reads every record of a catalog file.
   *
   * @param file catalog file
   * @return records in file order
   * @throws CatalogFormatException when a row has the wrong column count, a non-numeric value or a fractional flag
   * @throws IOException when the file cannot be read
   */
  public static List<SourceRecord> read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    List<SourceRecord> records = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        records.add(parseRow(file, lineNumber, WHITESPACE.split(trimmed)));
      }
    }
    return records;
  }

  static SourceRecord parseRow(Path file, int lineNumber, String[] tokens) throws CatalogFormatException {
    if (tokens.length != SourceRecord.COLUMN_COUNT) {
      throw CatalogFormatException.atLine(file, lineNumber,
          "expected " + SourceRecord.COLUMN_COUNT + " columns but found " + tokens.length);
    }
    double[] columns = new double[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      try {
        columns[i] = Double.parseDouble(tokens[i]);
      } catch (NumberFormatException ex) {
        throw CatalogFormatException.atLine(file, lineNumber,
            "column " + SourceRecord.COLUMN_NAMES[i] + " is not numeric: " + tokens[i]);
      }
    }
    double flag = columns[0];
    if (!Double.isFinite(flag) || flag != Math.rint(flag) || flag < Integer.MIN_VALUE || flag > Integer.MAX_VALUE) {
      throw CatalogFormatException.atLine(file, lineNumber,
          "column " + SourceRecord.COLUMN_NAMES[0] + " is not a whole number: " + tokens[0]);
    }
    return SourceRecord.fromColumns(columns);
  }
}
