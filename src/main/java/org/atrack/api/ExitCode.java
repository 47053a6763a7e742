package org.atrack.api;

/**
 * Process exit codes shared by every command.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed, including runs that found no moving objects. */
  SUCCESS(0),
  /** Malformed arguments, missing inputs or too few catalogs. */
  INVALID_ARGS(2),
  /** Catalog, manifest or output I/O failed. */
  IO_ERROR(3),
  /** A configuration value was rejected after the run started. */
  CONFIG_ERROR(4),
  /** Unexpected failure, including a failed worker. */
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
