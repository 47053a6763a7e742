package org.atrack.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Indices of three images searched together for a segment, {@code first < second < third}.
 *
 * @param first earliest image index
 * @param second middle image index
 * @param third latest image index
 * @since 0.1.0
 */
public record ImageTriplet(int first, int second, int third) {

  public ImageTriplet {
    if (first < 0 || !(first < second && second < third)) {
      throw new IllegalArgumentException(
          "triplet indices must satisfy 0 <= i < j < k (was " + first + "," + second + "," + third + ")");
    }
  }

  /**
   * Enumerates every 3-combination of the given image indices in lexicographic order.
   *
   * @param imageIndices ascending image indices
   * @return all triplets
   */
  public static List<ImageTriplet> combinations(List<Integer> imageIndices) {
    List<ImageTriplet> triplets = new ArrayList<>();
    int n = imageIndices.size();
    for (int i = 0; i < n - 2; i++) {
      for (int j = i + 1; j < n - 1; j++) {
        for (int k = j + 1; k < n; k++) {
          triplets.add(new ImageTriplet(imageIndices.get(i), imageIndices.get(j), imageIndices.get(k)));
        }
      }
    }
    return triplets;
  }

  @Override
  public String toString() {
    return "(" + first + "," + second + "," + third + ")";
  }
}
