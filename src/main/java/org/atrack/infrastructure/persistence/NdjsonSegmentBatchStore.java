package org.atrack.infrastructure.persistence;

import org.atrack.application.port.SegmentBatchStore;
import org.atrack.domain.Candidate;
import org.atrack.domain.Segment;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SegmentBatchStore} writing one NDJSON file per worker.
 * <p><strong>Layout:</strong> {@code <dir>/worker-NNNN.ndjson}, one line per segment:
 * {@code {"schemaVersion":1,"worker":n,"points":[candidate x3]}}.</p>
 * <p><strong>Thread-safety:</strong> concurrent writers must use distinct worker indices.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonSegmentBatchStore implements SegmentBatchStore {
  private static final Logger log = LoggerFactory.getLogger(NdjsonSegmentBatchStore.class);
  static final int SCHEMA_VERSION = 1;
  private static final Pattern BATCH_NAME = Pattern.compile("worker-(\\d{4,})\\.ndjson");

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path directory;

  /**
   * Creates a store rooted at {@code directory}; the directory is created on first write.
   *
   * @param directory batch directory
   */
  public NdjsonSegmentBatchStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  static String batchFileName(int worker) {
    return String.format("worker-%04d.ndjson", worker);
  }

  @Override
  public void write(int worker, List<Segment> segments) throws IOException {
    if (worker < 0) {
      throw new IllegalArgumentException("worker must be >= 0 (was " + worker + ")");
    }
    Files.createDirectories(directory);
    Path file = directory.resolve(batchFileName(worker));
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      for (Segment segment : segments) {
        try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
          gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
          gen.writeStartObject();
          gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
          gen.writeNumberField("worker", worker);
          gen.writeArrayFieldStart("points");
          for (Candidate point : segment.points()) {
            CandidateJson.write(gen, point);
          }
          gen.writeEndArray();
          gen.writeEndObject();
        }
        out.newLine();
      }
    }
    log.debug("Wrote {} segments to {}", segments.size(), file.getFileName());
  }

  @Override
  public List<Segment> readAll() throws IOException {
    List<Segment> segments = new ArrayList<>();
    for (Path file : batchFiles()) {
      readBatch(file, segments);
    }
    return segments;
  }

  @Override
  public void clear() throws IOException {
    for (Path file : batchFiles()) {
      Files.deleteIfExists(file);
    }
  }

  private void readBatch(Path file, List<Segment> segments) throws IOException {
    try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = in.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          segments.add(parseLine(line));
        } catch (IOException | IllegalArgumentException ex) {
          throw new IOException("Malformed segment batch " + file + ":" + lineNumber + ": " + ex.getMessage(), ex);
        }
      }
    }
  }

  private Segment parseLine(String line) throws IOException {
    try (JsonParser parser = jsonFactory.createParser(line)) {
      CandidateJson.expect(parser, parser.nextToken(), JsonToken.START_OBJECT);
      List<Candidate> points = new ArrayList<>(3);
      Integer version = null;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "schemaVersion" -> version = parser.getIntValue();
          case "points" -> {
            CandidateJson.expect(parser, value, JsonToken.START_ARRAY);
            while (parser.nextToken() != JsonToken.END_ARRAY) {
              points.add(CandidateJson.read(parser));
            }
          }
          default -> parser.skipChildren();
        }
      }
      if (version == null || version != SCHEMA_VERSION) {
        throw new IOException("unsupported schemaVersion " + version);
      }
      if (points.size() != 3) {
        throw new IOException("segment needs 3 points but has " + points.size());
      }
      return new Segment(points.get(0), points.get(1), points.get(2));
    }
  }

  private List<Path> batchFiles() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<Path> files = new ArrayList<>();
    try (Stream<Path> entries = Files.list(directory)) {
      entries.filter(path -> BATCH_NAME.matcher(path.getFileName().toString()).matches())
          .sorted((a, b) -> Integer.compare(workerOf(a), workerOf(b)))
          .forEach(files::add);
    }
    return files;
  }

  private static int workerOf(Path file) {
    Matcher matcher = BATCH_NAME.matcher(file.getFileName().toString());
    return matcher.matches() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
  }
}
