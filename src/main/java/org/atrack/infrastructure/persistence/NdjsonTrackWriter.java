package org.atrack.infrastructure.persistence;

import org.atrack.application.port.TrackSink;
import org.atrack.domain.Candidate;
import org.atrack.domain.ClassifiedTrack;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes classified tracks to an NDJSON file, one object per line, replacing any previous file.
 *
 * @since 0.1.0
 */
public final class NdjsonTrackWriter implements TrackSink {
  private static final Logger log = LoggerFactory.getLogger(NdjsonTrackWriter.class);
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path file;

  /**
   * Creates a writer.
   *
   * @param file output file; parent directories are created on write
   */
  public NdjsonTrackWriter(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public void write(List<ClassifiedTrack> tracks) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      for (ClassifiedTrack track : tracks) {
        try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
          gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
          gen.writeStartObject();
          gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
          gen.writeNumberField("objectId", track.objectId());
          gen.writeStringField("classification", track.classification().name());
          gen.writeNumberField("angularSpeedRadPerMin", track.angularSpeedRadPerMin());
          gen.writeNumberField("speedArcsecPerMin", track.speedArcsecPerMin());
          gen.writeArrayFieldStart("points");
          for (Candidate point : track.track().points()) {
            CandidateJson.write(gen, point);
          }
          gen.writeEndArray();
          gen.writeEndObject();
        }
        out.newLine();
      }
    }
    log.info("Wrote {} tracks to {}", tracks.size(), file);
  }
}
