package org.atrack.application.pipeline;

import org.atrack.config.DetectionConfig;
import org.atrack.config.MergeStrategy;
import org.atrack.config.PointIdentity;
import org.atrack.domain.Candidate;
import org.atrack.domain.Segment;
import org.atrack.domain.SkyGeometry;
import org.atrack.domain.Track;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Combines segments that share points into tracks.
 * <p><strong>Strategies:</strong>
 * <ul>
 *   <li>{@link MergeStrategy#GREEDY}: one ordered pass. For each segment the first track holding one or two of its
 *   points absorbs the remaining points; a track already holding all three discards it; a segment sharing nothing
 *   starts a new track. The result can depend on segment order.</li>
 *   <li>{@link MergeStrategy#CONNECTED}: tracks are the connected components of the "shares a point" relation,
 *   independent of segment order.</li>
 * </ul>
 * <p><strong>Invariant:</strong> a track never holds two points from one image. When a point arrives for an image
 * the track already covers, the earlier point is kept.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #merge(List)} keeps all working state local.</p>
 *
 * @since 0.1.0
 */
public final class SegmentMerger {
  private static final Logger log = LoggerFactory.getLogger(SegmentMerger.class);

  private final MergeStrategy strategy;
  private final PointIdentity identity;
  private final double toleranceRad;

  public SegmentMerger(DetectionConfig config) {
    this(config.mergeStrategy(), config.pointIdentity(), config.pointToleranceRad());
  }

  /**
   * Creates a merger.
   *
   * @param strategy merge strategy
   * @param identity point identity rule
   * @param toleranceRad match radius for {@link PointIdentity#TOLERANCE}, radians
   */
  public SegmentMerger(MergeStrategy strategy, PointIdentity identity, double toleranceRad) {
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.toleranceRad = toleranceRad;
  }

  /**
   * Merges segments into tracks.
   *
   * @param segments all segments, in worker order
   * @return tracks in creation order, points sorted by image index
   */
  public List<Track> merge(List<Segment> segments) {
    Objects.requireNonNull(segments, "segments");
    List<TrackBuilder> builders = strategy == MergeStrategy.GREEDY
        ? mergeGreedy(segments)
        : mergeConnected(segments);
    List<Track> tracks = new ArrayList<>(builders.size());
    for (TrackBuilder builder : builders) {
      tracks.add(builder.build());
    }
    log.debug("Merged {} segments into {} tracks using {}", segments.size(), tracks.size(), strategy);
    return tracks;
  }

  private List<TrackBuilder> mergeGreedy(List<Segment> segments) {
    List<TrackBuilder> tracks = new ArrayList<>();
    for (Segment segment : segments) {
      List<Candidate> points = segment.points();
      boolean absorbed = false;
      for (TrackBuilder track : tracks) {
        boolean[] shared = new boolean[points.size()];
        int sharedCount = 0;
        for (int i = 0; i < points.size(); i++) {
          shared[i] = track.contains(points.get(i));
          if (shared[i]) {
            sharedCount++;
          }
        }
        if (sharedCount == 0) {
          continue;
        }
        for (int i = 0; i < points.size(); i++) {
          if (!shared[i]) {
            track.add(points.get(i));
          }
        }
        absorbed = true;
        break;
      }
      if (!absorbed) {
        tracks.add(new TrackBuilder(points));
      }
    }
    return tracks;
  }

  private List<TrackBuilder> mergeConnected(List<Segment> segments) {
    int[] parent = new int[segments.size()];
    for (int i = 0; i < parent.length; i++) {
      parent[i] = i;
    }
    List<PointOwner> owners = new ArrayList<>();
    Map<PointKey, Integer> exactOwners = new HashMap<>();
    for (int s = 0; s < segments.size(); s++) {
      for (Candidate point : segments.get(s).points()) {
        if (identity == PointIdentity.EXACT) {
          Integer owner = exactOwners.putIfAbsent(PointKey.of(point), s);
          if (owner != null) {
            union(parent, owner, s);
          }
        } else {
          for (PointOwner owner : owners) {
            if (sameTolerant(owner.point(), point)) {
              union(parent, owner.segment(), s);
            }
          }
          owners.add(new PointOwner(point, s));
        }
      }
    }

    Map<Integer, TrackBuilder> components = new LinkedHashMap<>();
    for (int s = 0; s < segments.size(); s++) {
      int root = find(parent, s);
      List<Candidate> points = segments.get(s).points();
      TrackBuilder track = components.get(root);
      if (track == null) {
        components.put(root, new TrackBuilder(points));
      } else {
        for (Candidate point : points) {
          if (!track.contains(point)) {
            track.add(point);
          }
        }
      }
    }
    return new ArrayList<>(components.values());
  }

  private static int find(int[] parent, int node) {
    int root = node;
    while (parent[root] != root) {
      root = parent[root];
    }
    while (parent[node] != root) {
      int next = parent[node];
      parent[node] = root;
      node = next;
    }
    return root;
  }

  private static void union(int[] parent, int a, int b) {
    int rootA = find(parent, a);
    int rootB = find(parent, b);
    if (rootA != rootB) {
      parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
    }
  }

  private boolean samePoint(Candidate a, Candidate b) {
    if (identity == PointIdentity.EXACT) {
      return a.ra() == b.ra() && a.dec() == b.dec();
    }
    return sameTolerant(a, b);
  }

  private boolean sameTolerant(Candidate a, Candidate b) {
    return a.imageIndex() == b.imageIndex() && SkyGeometry.isWithin(a, b, toleranceRad);
  }

  /** Mutable track under construction; one point per image, first arrival wins. */
  private final class TrackBuilder {
    private final Map<Integer, Candidate> byImage = new LinkedHashMap<>();

    TrackBuilder(List<Candidate> initial) {
      for (Candidate point : initial) {
        add(point);
      }
    }

    boolean contains(Candidate point) {
      for (Candidate existing : byImage.values()) {
        if (samePoint(existing, point)) {
          return true;
        }
      }
      return false;
    }

    void add(Candidate point) {
      Candidate existing = byImage.putIfAbsent(point.imageIndex(), point);
      if (existing != null && existing != point) {
        log.debug("Dropping point ({}, {}) from image {}: track already holds ({}, {})",
            point.ra(), point.dec(), point.imageIndex(), existing.ra(), existing.dec());
      }
    }

    Track build() {
      return new Track(new ArrayList<>(byImage.values()));
    }
  }

  private record PointKey(double ra, double dec) {
    static PointKey of(Candidate point) {
      // + 0.0 folds -0.0 into 0.0 so keys agree with ==
      return new PointKey(point.ra() + 0.0, point.dec() + 0.0);
    }
  }

  private record PointOwner(Candidate point, int segment) {}
}
