package com.findawise.pointers.infrastructure.content;

import com.findawise.pointers.application.port.ContentNodeSource;
import com.findawise.pointers.domain.content.ContentNode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory content store with slug lookup and retired-slug aliases.
 */
public final class InMemoryContentNodeStore implements ContentNodeSource {
  private final Map<String, ContentNode> byId = new ConcurrentHashMap<>();
  private final Map<String, String> slugAliases = new ConcurrentHashMap<>();

  public InMemoryContentNodeStore() {}

  public InMemoryContentNodeStore(List<ContentNode> nodes) {
    nodes.forEach(this::put);
  }

  public void put(ContentNode node) {
    Objects.requireNonNull(node, "node");
    byId.put(node.id(), node);
  }

  public boolean remove(String id) {
    return byId.remove(id) != null;
  }

  /**
   * Records that {@code retiredSlug} moved to {@code currentSlug}.
   *
   * @param retiredSlug slug that no longer resolves
   * @param currentSlug slug to redirect to
   */
  public void alias(String retiredSlug, String currentSlug) {
    slugAliases.put(Objects.requireNonNull(retiredSlug, "retiredSlug"), Objects.requireNonNull(currentSlug, "currentSlug"));
  }

  @Override
  public Optional<ContentNode> findById(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<ContentNode> findBySlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    return byId.values().stream().filter(node -> slug.equals(node.slug())).findFirst();
  }

  @Override
  public List<ContentNode> listAll() {
    return byId.values().stream().sorted(Comparator.comparing(ContentNode::id)).toList();
  }

  @Override
  public Optional<String> redirectFor(String slug) {
    return slug == null ? Optional.empty() : Optional.ofNullable(slugAliases.get(slug));
  }
}
