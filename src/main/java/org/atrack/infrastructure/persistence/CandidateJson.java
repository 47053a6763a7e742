package org.atrack.infrastructure.persistence;

import org.atrack.domain.Candidate;
import org.atrack.domain.SourceRecord;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;

/** Streaming JSON form of a {@link Candidate}: {@code imageIndex} plus one field per catalog column. */
final class CandidateJson {
  static final String IMAGE_INDEX = "imageIndex";

  private CandidateJson() {}

  static void write(JsonGenerator gen, Candidate candidate) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField(IMAGE_INDEX, candidate.imageIndex());
    SourceRecord record = candidate.record();
    gen.writeNumberField(SourceRecord.COLUMN_NAMES[0], record.flag());
    double[] columns = record.toColumns();
    for (int i = 1; i < columns.length; i++) {
      gen.writeNumberField(SourceRecord.COLUMN_NAMES[i], columns[i]);
    }
    gen.writeEndObject();
  }

  /**
   * Reads one candidate object; the parser must be positioned on its {@code START_OBJECT}.
   */
  static Candidate read(JsonParser parser) throws IOException {
    expect(parser, parser.currentToken(), JsonToken.START_OBJECT);
    Integer imageIndex = null;
    double[] columns = new double[SourceRecord.COLUMN_COUNT];
    boolean[] seen = new boolean[SourceRecord.COLUMN_COUNT];
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      parser.nextToken();
      if (IMAGE_INDEX.equals(field)) {
        imageIndex = parser.getIntValue();
        continue;
      }
      int column = columnIndex(field);
      if (column < 0) {
        parser.skipChildren();
        continue;
      }
      columns[column] = number(parser);
      seen[column] = true;
    }
    if (imageIndex == null) {
      throw new IOException("candidate is missing " + IMAGE_INDEX + " at " + parser.currentLocation());
    }
    for (int i = 0; i < seen.length; i++) {
      if (!seen[i]) {
        throw new IOException("candidate is missing " + SourceRecord.COLUMN_NAMES[i] + " at "
            + parser.currentLocation());
      }
    }
    return new Candidate(imageIndex, SourceRecord.fromColumns(columns));
  }

  static void expect(JsonParser parser, JsonToken actual, JsonToken expected) throws IOException {
    if (actual != expected) {
      throw new IOException("expected " + expected + " but found " + actual + " at " + parser.currentLocation());
    }
  }

  // Non-finite doubles are written as quoted strings.
  private static double number(JsonParser parser) throws IOException {
    if (parser.currentToken() == JsonToken.VALUE_STRING) {
      try {
        return Double.parseDouble(parser.getText());
      } catch (NumberFormatException ex) {
        throw new IOException("not a number: " + parser.getText() + " at " + parser.currentLocation(), ex);
      }
    }
    return parser.getDoubleValue();
  }

  private static int columnIndex(String field) {
    for (int i = 0; i < SourceRecord.COLUMN_NAMES.length; i++) {
      if (SourceRecord.COLUMN_NAMES[i].equals(field)) {
        return i;
      }
    }
    return -1;
  }
}
