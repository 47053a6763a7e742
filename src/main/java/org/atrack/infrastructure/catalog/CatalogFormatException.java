package org.atrack.infrastructure.catalog;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a catalog, master catalog or frame manifest cannot be parsed.
 *
 * @since 0.1.0
 */
public final class CatalogFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public CatalogFormatException(String message) {
    super(message);
  }

  public CatalogFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates an exception pointing at one line of a file.
   *
   * @param file offending file
   * @param line 1-based line number
   * @param reason description of the problem
   * @return exception
   */
  public static CatalogFormatException atLine(Path file, int line, String reason) {
    return new CatalogFormatException(file + ":" + line + ": " + reason);
  }
}
