package org.atrack.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Candidate lists for every image of a run, keyed by image index.
 *
 * <p>Immutable once built; shared read-only by segment detection workers.</p>
 *
 * @since 0.1.0
 */
public final class CandidateSet {
  private final SortedMap<Integer, ImageCandidates> images;

  /**
   * Creates a set from per-image candidate lists.
   *
   * @param images per-image lists; image indices must be unique
   */
  public CandidateSet(List<ImageCandidates> images) {
    Objects.requireNonNull(images, "images");
    SortedMap<Integer, ImageCandidates> byIndex = new TreeMap<>();
    for (ImageCandidates image : images) {
      if (byIndex.put(image.imageIndex(), image) != null) {
        throw new IllegalArgumentException("duplicate image index " + image.imageIndex());
      }
    }
    this.images = Collections.unmodifiableSortedMap(byIndex);
  }

  /**
   * Returns the entry for {@code imageIndex}.
   *
   * @param imageIndex image index
   * @return per-image candidates
   * @throws IllegalArgumentException when the index is unknown
   */
  public ImageCandidates image(int imageIndex) {
    ImageCandidates image = images.get(imageIndex);
    if (image == null) {
      throw new IllegalArgumentException("unknown image index " + imageIndex);
    }
    return image;
  }

  public List<Candidate> candidates(int imageIndex) {
    return image(imageIndex).candidates();
  }

  public ImageMetadata metadata(int imageIndex) {
    return image(imageIndex).metadata();
  }

  /** Calibration of every image keyed by image index. */
  public Map<Integer, ImageMetadata> metadataByImage() {
    Map<Integer, ImageMetadata> metadata = new LinkedHashMap<>();
    for (ImageCandidates image : images.values()) {
      metadata.put(image.imageIndex(), image.metadata());
    }
    return Collections.unmodifiableMap(metadata);
  }

  /** Image indices in ascending order. */
  public List<Integer> imageIndices() {
    return List.copyOf(images.keySet());
  }

  /** Per-image entries in ascending image order. */
  public List<ImageCandidates> images() {
    return new ArrayList<>(images.values());
  }

  public int imageCount() {
    return images.size();
  }

  /** Total candidates across all images. */
  public int totalCandidates() {
    int total = 0;
    for (ImageCandidates image : images.values()) {
      total += image.candidates().size();
    }
    return total;
  }
}
