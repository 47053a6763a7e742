package org.atrack.infrastructure.persistence;

import static org.atrack.testutil.Fixtures.ARCSEC;
import static org.atrack.testutil.Fixtures.candidate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.atrack.domain.Angles;
import org.atrack.domain.ClassifiedTrack;
import org.atrack.domain.Track;
import org.atrack.domain.TrackClass;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonTrackWriterTest {
  @TempDir Path tempDir;

  @Test
  void writesOneObjectPerLine() throws IOException {
    Track track = new Track(List.of(
        candidate(0, 150.0, 0.0), candidate(1, 150.0 + 10 * ARCSEC, 0.0), candidate(3, 150.0 + 30 * ARCSEC, 0.0)));
    ClassifiedTrack moving = new ClassifiedTrack(1, track, Angles.arcsecToRadians(1.0), TrackClass.MOVING);
    ClassifiedTrack slow = new ClassifiedTrack(2, track, 0.0, TrackClass.UNCERTAIN);
    Path file = tempDir.resolve("out/tracks.ndjson");

    new NdjsonTrackWriter(file).write(List.of(moving, slow));

    List<String> lines = Files.readAllLines(file);
    assertEquals(2, lines.size());
    try (JsonParser parser = new JsonFactory().createParser(lines.get(0))) {
      assertEquals(JsonToken.START_OBJECT, parser.nextToken());
      int points = 0;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "schemaVersion" -> assertEquals(1, parser.getIntValue());
          case "objectId" -> assertEquals(1, parser.getIntValue());
          case "classification" -> assertEquals("MOVING", parser.getText());
          case "speedArcsecPerMin" -> assertEquals(1.0, parser.getDoubleValue(), 1e-9);
          case "points" -> {
            assertEquals(JsonToken.START_ARRAY, value);
            while (parser.nextToken() != JsonToken.END_ARRAY) {
              points++;
              parser.skipChildren();
            }
          }
          default -> parser.skipChildren();
        }
      }
      assertEquals(3, points);
    }
    assertTrue(lines.get(1).contains("\"classification\":\"UNCERTAIN\""));
  }

  @Test
  void emptyResultLeavesAnEmptyFile() throws IOException {
    Path file = tempDir.resolve("tracks.ndjson");

    new NdjsonTrackWriter(file).write(List.of());

    assertEquals(0, Files.size(file));
  }
}
