package com.findawise.pointers.infrastructure.retrieval;

import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.domain.error.ContentFetchException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads {@code file} pointers relative to a sandbox root. Targets resolving outside the root are
 * refused.
 */
public final class FileContentRetriever implements ContentRetriever {
  private final FileSandbox sandbox;

  public FileContentRetriever(Path root) {
    this(new FileSandbox(root));
  }

  FileContentRetriever(FileSandbox sandbox) {
    this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
  }

  @Override
  public RetrievedContent retrieve(ContentPointer pointer) {
    Path file = sandbox.resolve(pointer.targetId())
        .orElseThrow(() -> new ContentFetchException("File target escapes content root: " + pointer.targetId()));
    try {
      return new RetrievedContent(Files.readString(file, StandardCharsets.UTF_8), contentTypeOf(file), "filesystem");
    } catch (IOException ex) {
      throw new ContentFetchException("Unable to read " + pointer.targetId() + ": " + ex.getMessage(), ex);
    }
  }

  static String contentTypeOf(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".html") || name.endsWith(".htm")) {
      return "text/html";
    }
    if (name.endsWith(".json")) {
      return "application/json";
    }
    if (name.endsWith(".md")) {
      return "text/markdown";
    }
    return "text/plain";
  }
}
