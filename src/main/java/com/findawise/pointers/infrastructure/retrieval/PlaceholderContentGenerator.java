package com.findawise.pointers.infrastructure.retrieval;

import com.findawise.pointers.application.fetch.ContentFetcher;
import com.findawise.pointers.application.port.DynamicContentGenerator;
import com.findawise.pointers.domain.pointer.ContentPointer;

/**
 * Generator used until a real one is wired: renders an escaped placeholder paragraph.
 */
public final class PlaceholderContentGenerator implements DynamicContentGenerator {
  @Override
  public String generate(ContentPointer pointer) {
    return "<p>Dynamic content for " + ContentFetcher.escapeHtml(pointer.targetId()) + "</p>";
  }
}
