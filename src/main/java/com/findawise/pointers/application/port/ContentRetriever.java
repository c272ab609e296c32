package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;

/**
 * Retrieval strategy for one pointer type.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ContentRetriever {
  /**
   * Resolves the pointer's target to content.
   *
   * @param pointer pointer to resolve
   * @return retrieved content
   * @throws com.findawise.pointers.domain.error.ContentFetchException when the target cannot be resolved
   */
  RetrievedContent retrieve(ContentPointer pointer);
}
