package com.findawise.pointers.infrastructure.retrieval;

import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.application.port.DynamicContentGenerator;
import com.findawise.pointers.domain.error.ContentFetchException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import java.util.Objects;

/**
 * Delegates {@code dynamic} pointers (and types without their own retriever) to a generator.
 */
public final class DynamicContentRetriever implements ContentRetriever {
  private final DynamicContentGenerator generator;

  public DynamicContentRetriever(DynamicContentGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  @Override
  public RetrievedContent retrieve(ContentPointer pointer) {
    String content = generator.generate(pointer);
    if (content == null) {
      throw new ContentFetchException("Generator produced no content for " + pointer.targetId());
    }
    return new RetrievedContent(content, "text/html", "dynamic");
  }
}
