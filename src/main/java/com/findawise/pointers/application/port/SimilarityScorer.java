package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.content.ContentNode;

/**
 * Similarity measure between two content nodes.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SimilarityScorer {
  /**
   * Scores how similar two nodes are.
   *
   * @param first first node
   * @param second second node
   * @return similarity in {@code [0,1]}; zero when the nodes cannot be compared
   */
  double similarity(ContentNode first, ContentNode second);
}
