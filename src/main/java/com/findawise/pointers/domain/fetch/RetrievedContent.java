package com.findawise.pointers.domain.fetch;

import java.util.Objects;

/**
 * Content produced by a retriever.
 *
 * @param content body text
 * @param contentType MIME type of {@code content}
 * @param source label of the retrieval channel, e.g. {@code cms} or {@code filesystem}
 * @since 0.1.0
 */
public record RetrievedContent(String content, String contentType, String source) {
  public RetrievedContent {
    Objects.requireNonNull(content, "content");
    contentType = contentType == null || contentType.isBlank() ? "text/html" : contentType;
    Objects.requireNonNull(source, "source");
  }
}
