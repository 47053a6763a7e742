package org.atrack.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem checks for catalog inputs and detection output directories.
 *
 * <p>Failures surface as {@link IllegalArgumentException} so the CLI maps them to invalid-argument exits.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves an existing, readable directory to its real path.
   *
   * @param name key reported in the error message
   * @param path directory to check
   * @return real path
   * @throws IllegalArgumentException when missing, not a directory or unreadable
   */
  public static Path requireReadableDirectory(String name, Path path) {
    Path real = realPath(name, path);
    if (!Files.isDirectory(real)) {
      throw new IllegalArgumentException(name + " must be an existing directory: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  /**
   * Resolves an existing, readable regular file to its real path.
   *
   * @param name key reported in the error message
   * @param path file to check
   * @return real path
   * @throws IllegalArgumentException when missing, not a regular file or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path real = realPath(name, path);
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException(name + " must be an existing file: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  /**
   * Validates (and optionally creates) an output directory.
   *
   * @param path target directory
   * @param createIfMissing create the directory and its parents when absent
   * @param allowReuse accept a non-empty existing directory
   * @return normalized real path, or the normalized path when not created
   * @throws IllegalArgumentException when the directory cannot be used
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }

      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      Path parentReal = createIfMissing
          ? Files.createDirectories(parent).toRealPath(LinkOption.NOFOLLOW_LINKS)
          : nearestExistingAncestor(parent);
      if (!Files.isDirectory(parentReal)) {
        throw new IllegalArgumentException("parent is not a directory: " + parentReal);
      }
      if (!Files.isWritable(parentReal)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parentReal);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path realPath(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to access " + name + ": " + path, ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
