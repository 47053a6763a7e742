package org.atrack.application.port;

import org.atrack.domain.ImageCandidates;
import java.io.IOException;

/**
 * Receives the filtered candidates of each image. Called from filter workers, one call per image.
 *
 * @since 0.1.0
 */
public interface CandidateSink {
  /**
   * Persists one image's candidates.
   *
   * @param image candidates of a single image
   * @throws IOException when the candidates cannot be written
   */
  void write(ImageCandidates image) throws IOException;

  /** Sink that discards candidates. */
  CandidateSink NONE = image -> {};
}
