package org.atrack.application.port;

import org.atrack.domain.ClassifiedTrack;
import java.io.IOException;
import java.util.List;

/**
 * Receives the classified tracks of a run, moving and uncertain together in object id order.
 *
 * @since 0.1.0
 */
public interface TrackSink {
  /**
   * Persists the classified tracks.
   *
   * @param tracks tracks ordered by object id
   * @throws IOException when the tracks cannot be written
   */
  void write(List<ClassifiedTrack> tracks) throws IOException;

  /** Sink that discards tracks. */
  TrackSink NONE = tracks -> {};
}
