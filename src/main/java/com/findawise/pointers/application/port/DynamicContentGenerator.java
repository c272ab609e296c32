package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.pointer.ContentPointer;

/**
 * Produces content for {@code dynamic} pointers on demand.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DynamicContentGenerator {
  /**
   * Generates markup for the pointer's target.
   *
   * @param pointer dynamic pointer
   * @return generated HTML
   */
  String generate(ContentPointer pointer);
}
