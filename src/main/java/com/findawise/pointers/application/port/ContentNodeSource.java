package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.content.ContentNode;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the external content store.
 *
 * @since 0.1.0
 */
public interface ContentNodeSource {
  Optional<ContentNode> findById(String id);

  Optional<ContentNode> findBySlug(String slug);

  /**
   * Lists every node eligible as a relationship candidate.
   *
   * @return snapshot of the store's nodes
   */
  List<ContentNode> listAll();

  /**
   * Returns the slug a retired slug now points to, when the store keeps such aliases.
   *
   * @param slug slug that no longer resolves directly
   * @return current slug, or empty when no alias exists
   */
  default Optional<String> redirectFor(String slug) {
    return Optional.empty();
  }
}
