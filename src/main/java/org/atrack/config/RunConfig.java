package org.atrack.config;

import org.atrack.validation.Numbers;
import org.atrack.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> File locations and execution settings for one detection run.
 * <p><strong>Role:</strong> Adapter configuration for the {@code candidates} and {@code detect} commands.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param catalogDirectory directory holding one source catalog per image
 * @param framesManifest optional frame metadata manifest; defaults to {@code frames.yaml} in the catalog directory
 * @param masterCatalog optional master catalog file; when absent one is looked up or built from the images
 * @param outputDirectory root directory for candidate, segment and track outputs
 * @param workers worker pool size for the parallel phases
 * @param keepSegments keep per-worker segment batch files after merging
 * @since 0.1.0
 */
public record RunConfig(
    Path catalogDirectory,
    Optional<Path> framesManifest,
    Optional<Path> masterCatalog,
    Path outputDirectory,
    int workers,
    boolean keepSegments) {

  /** Manifest file name looked up in the catalog directory when none is configured. */
  public static final String DEFAULT_MANIFEST = "frames.yaml";
  private static final int MAX_WORKERS = 1_024;

  public RunConfig {
    catalogDirectory = normalize("catalogs", catalogDirectory);
    framesManifest = Objects.requireNonNullElse(framesManifest, Optional.<Path>empty())
        .map(path -> normalize("frames", path));
    masterCatalog = Objects.requireNonNullElse(masterCatalog, Optional.<Path>empty())
        .map(path -> normalize("master", path));
    outputDirectory = normalize("out", outputDirectory);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
  }

  /**
   * Builds a run configuration from flattened key/value options.
   *
   * @param options keys {@code catalogs} (required), {@code out}, {@code frames}, {@code master},
   *     {@code workers}, {@code keepSegments}
   * @return populated configuration
   * @throws IllegalArgumentException when {@code catalogs} is missing or a value is malformed
   */
  public static RunConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String catalogs = options.get("catalogs");
    if (catalogs == null || catalogs.isBlank()) {
      throw new IllegalArgumentException("catalogs is required");
    }
    String out = options.get("out");
    Path output = out == null || out.isBlank() ? defaultOutputDirectory() : parsePath("out", out);
    String workersRaw = options.get("workers");
    int workers = workersRaw == null || workersRaw.isBlank()
        ? defaultWorkers()
        : Numbers.parseInt("workers", workersRaw);
    return new RunConfig(
        parsePath("catalogs", catalogs),
        optionalPath("frames", options.get("frames")),
        optionalPath("master", options.get("master")),
        output,
        workers,
        parseBoolean(options.get("keepSegments"), false));
  }

  /** Manifest to read: the configured one, or {@value #DEFAULT_MANIFEST} inside the catalog directory. */
  public Path effectiveFramesManifest() {
    return framesManifest.orElseGet(() -> catalogDirectory.resolve(DEFAULT_MANIFEST));
  }

  public Path candidatesDirectory() {
    return outputDirectory.resolve("candidates");
  }

  public Path segmentsDirectory() {
    return outputDirectory.resolve("segments");
  }

  public Path tracksFile() {
    return outputDirectory.resolve("tracks.ndjson");
  }

  /** Default pool size: one worker per available processor. */
  public static int defaultWorkers() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  /** Default output root under the user's home directory. */
  public static Path defaultOutputDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".atrack", "out");
  }

  private static Optional<Path> optionalPath(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, raw));
  }

  private static Path parsePath(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    return path.toAbsolutePath().normalize();
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException("keepSegments must be true or false (was " + value + ")");
    }
    return Boolean.parseBoolean(normalized);
  }
}
