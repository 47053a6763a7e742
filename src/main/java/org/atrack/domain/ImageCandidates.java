package org.atrack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Filtered candidates of one image together with that image's calibration.
 *
 * @param imageIndex image position in the sequence
 * @param name catalog name
 * @param metadata capture calibration
 * @param candidates transient sources kept by the filter
 * @since 0.1.0
 */
public record ImageCandidates(int imageIndex, String name, ImageMetadata metadata, List<Candidate> candidates) {

  public ImageCandidates {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(metadata, "metadata");
    candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
    for (Candidate candidate : candidates) {
      if (candidate.imageIndex() != imageIndex) {
        throw new IllegalArgumentException(
            "candidate from image " + candidate.imageIndex() + " listed under image " + imageIndex);
      }
    }
  }
}
