package org.atrack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ordered point-source records extracted from one image.
 *
 * @param imageIndex zero-based position of the image in the time-ordered sequence
 * @param name catalog name (file name without extension)
 * @param metadata capture calibration of the image
 * @param records source records in catalog order
 * @since 0.1.0
 */
public record Catalog(int imageIndex, String name, ImageMetadata metadata, List<SourceRecord> records) {

  public Catalog {
    if (imageIndex < 0) {
      throw new IllegalArgumentException("imageIndex must be >= 0 (was " + imageIndex + ")");
    }
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(metadata, "metadata");
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }
}
