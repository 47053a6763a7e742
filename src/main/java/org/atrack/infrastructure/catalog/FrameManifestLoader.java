package org.atrack.infrastructure.catalog;

import org.atrack.domain.ImageMetadata;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

/**
 * <strong>What:</strong> Loads per-image observation metadata from a YAML frame manifest.
 * <p><strong>Format:</strong> a mapping from catalog file name (or its stem) to
 * {@code date-obs}, optional {@code time-obs}, {@code exptime} and optional {@code xbinning}; the mapping may be
 * nested under a top-level {@code frames} key.</p>
 * <pre>
 * frames:
 *   img-001.cat:
 *     date-obs: 2021-03-04
 *     time-obs: 01:02:03.5
 *     exptime: 120
 *     xbinning: 2
 * </pre>
 * <p>Scalars are read as raw text so YAML 1.1 timestamp and sexagesimal resolution never rewrites header values.</p>
 *
 * @since 0.1.0
 */
public final class FrameManifestLoader {
  static final String FRAMES_KEY = "frames";
  static final String DATE_OBS = "date-obs";
  static final String TIME_OBS = "time-obs";
  static final String EXPTIME = "exptime";
  static final String XBINNING = "xbinning";

  private FrameManifestLoader() {}

  /**
   * Parses a manifest file.
   *
   * @param manifest manifest path
   * @return manifest keyed by frame name
   * @throws CatalogFormatException when the manifest is malformed or a frame entry is invalid
   * @throws IOException when the file cannot be read
   */
  public static FrameManifest load(Path manifest) throws IOException {
    Objects.requireNonNull(manifest, "manifest");
    Node root;
    try (Reader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
      root = new Yaml(new SafeConstructor(new LoaderOptions())).compose(reader);
    } catch (YAMLException ex) {
      throw new CatalogFormatException("Invalid frame manifest " + manifest + ": " + ex.getMessage(), ex);
    }
    if (root == null) {
      return new FrameManifest(Map.of());
    }
    MappingNode frames = asMapping(manifest, "root", root);
    Node nested = child(frames, FRAMES_KEY);
    if (nested != null) {
      frames = asMapping(manifest, FRAMES_KEY, nested);
    }

    Map<String, ImageMetadata> entries = new LinkedHashMap<>();
    for (NodeTuple tuple : frames.getValue()) {
      String name = scalar(manifest, "frame name", tuple.getKeyNode());
      MappingNode fields = asMapping(manifest, name, tuple.getValueNode());
      entries.put(name, parseFrame(manifest, name, fields));
    }
    return new FrameManifest(entries);
  }

  private static ImageMetadata parseFrame(Path manifest, String name, MappingNode fields)
      throws CatalogFormatException {
    Map<String, String> values = new LinkedHashMap<>();
    for (NodeTuple tuple : fields.getValue()) {
      String key = scalar(manifest, name, tuple.getKeyNode()).toLowerCase(Locale.ROOT);
      values.put(key, scalar(manifest, name + "." + key, tuple.getValueNode()));
    }
    try {
      Instant timestamp = ObservationTimestamps.parse(values.get(DATE_OBS), values.get(TIME_OBS));
      String exptime = values.get(EXPTIME);
      if (exptime == null) {
        throw new IllegalArgumentException("exptime is missing");
      }
      double exposure = Double.parseDouble(exptime.trim());
      String binningRaw = values.get(XBINNING);
      int binning = binningRaw == null ? 1 : (int) Double.parseDouble(binningRaw.trim());
      return new ImageMetadata(timestamp, exposure, binning);
    } catch (IllegalArgumentException ex) {
      // NumberFormatException included
      throw new CatalogFormatException(
          "Invalid frame '" + name + "' in " + manifest + ": " + ex.getMessage(), ex);
    }
  }

  private static Node child(MappingNode mapping, String key) {
    for (NodeTuple tuple : mapping.getValue()) {
      Node keyNode = tuple.getKeyNode();
      if (keyNode instanceof ScalarNode scalar && key.equals(scalar.getValue())) {
        return tuple.getValueNode();
      }
    }
    return null;
  }

  private static MappingNode asMapping(Path manifest, String where, Node node) throws CatalogFormatException {
    if (node instanceof MappingNode mapping) {
      return mapping;
    }
    throw new CatalogFormatException("Frame manifest " + manifest + " expects a mapping at " + where);
  }

  private static String scalar(Path manifest, String where, Node node) throws CatalogFormatException {
    if (node instanceof ScalarNode scalar) {
      return scalar.getValue();
    }
    throw new CatalogFormatException("Frame manifest " + manifest + " expects a scalar at " + where);
  }

  /**
   * Parsed manifest.
   *
   * @param frames metadata keyed by the names used in the manifest
   */
  public record FrameManifest(Map<String, ImageMetadata> frames) {
    public FrameManifest {
      frames = Map.copyOf(frames);
    }

    /**
     * Looks up a catalog by file name, falling back to the name without extension.
     *
     * @param fileName catalog file name
     * @return metadata when present
     */
    public Optional<ImageMetadata> lookup(String fileName) {
      ImageMetadata direct = frames.get(fileName);
      if (direct != null) {
        return Optional.of(direct);
      }
      return Optional.ofNullable(frames.get(CatalogFiles.stem(fileName)));
    }
  }
}
