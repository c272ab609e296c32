package com.findawise.pointers.infrastructure.retrieval;

import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.domain.error.ContentFetchException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;

/**
 * Stands in for {@code url} and {@code api} retrieval until a transport adapter is injected. Every
 * call fails, so pointers with fallback content still render.
 */
public final class UnconfiguredTransportRetriever implements ContentRetriever {
  @Override
  public RetrievedContent retrieve(ContentPointer pointer) {
    throw new ContentFetchException(
        "No transport configured for " + pointer.pointerType().wireName() + " pointers");
  }
}
