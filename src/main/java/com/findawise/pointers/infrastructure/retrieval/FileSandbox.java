package com.findawise.pointers.infrastructure.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves relative targets under a fixed root, refusing anything that normalizes outside it or
 * reaches outside it through a symbolic link.
 */
public final class FileSandbox {
  private final Path root;

  public FileSandbox(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  /**
   * Resolves {@code target} against the root.
   *
   * @param target relative path; a leading {@code /} is treated as relative to the root
   * @return resolved path, or empty when the target is invalid or escapes the root
   */
  public Optional<Path> resolve(String target) {
    if (target == null || target.isBlank() || target.indexOf('\0') >= 0) {
      return Optional.empty();
    }
    String relative = target.strip();
    while (relative.startsWith("/") || relative.startsWith("\\")) {
      relative = relative.substring(1);
    }
    try {
      Path resolved = root.resolve(relative).normalize();
      if (!resolved.startsWith(root) || resolved.equals(root)) {
        return Optional.empty();
      }
      return staysInsideRoot(resolved) ? Optional.of(resolved) : Optional.empty();
    } catch (InvalidPathException ex) {
      return Optional.empty();
    }
  }

  /** Checks the real location of the deepest existing part of {@code resolved} against the real root. */
  private boolean staysInsideRoot(Path resolved) {
    if (!Files.exists(root)) {
      return true;
    }
    Path existing = resolved;
    while (existing != null && !Files.exists(existing)) {
      existing = existing.getParent();
    }
    if (existing == null) {
      return false;
    }
    try {
      return existing.toRealPath().startsWith(root.toRealPath());
    } catch (IOException ex) {
      return false;
    }
  }
}
