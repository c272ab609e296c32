package com.findawise.pointers.infrastructure.retrieval;

import com.findawise.pointers.application.port.ContentNodeSource;
import com.findawise.pointers.application.port.ContentRetriever;
import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.content.ContentNodeStatus;
import com.findawise.pointers.domain.error.ContentFetchException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves {@code slug} and {@code id} pointers against the content store. Slug lookups report
 * source {@code cms}; id lookups report {@code database}.
 */
public final class ContentStoreRetriever implements ContentRetriever {
  /** Which key of the content node a pointer's target refers to. */
  public enum Lookup {
    SLUG("cms"),
    ID("database");

    private final String source;

    Lookup(String source) {
      this.source = source;
    }
  }

  private final ContentNodeSource nodes;
  private final Lookup lookup;

  public ContentStoreRetriever(ContentNodeSource nodes, Lookup lookup) {
    this.nodes = Objects.requireNonNull(nodes, "nodes");
    this.lookup = Objects.requireNonNull(lookup, "lookup");
  }

  @Override
  public RetrievedContent retrieve(ContentPointer pointer) {
    String target = pointer.targetId();
    Optional<ContentNode> node = lookup == Lookup.SLUG ? nodes.findBySlug(target) : nodes.findById(target);
    ContentNode found = node.orElseThrow(
        () -> new ContentFetchException("No content with " + lookup.name().toLowerCase(Locale.ROOT) + " " + target));
    if (found.status() == ContentNodeStatus.INACTIVE || found.status() == ContentNodeStatus.BROKEN) {
      throw new ContentFetchException("Content " + found.id() + " is " + found.status().name().toLowerCase(Locale.ROOT));
    }
    return new RetrievedContent(found.content(), contentTypeOf(found), lookup.source);
  }

  static String contentTypeOf(ContentNode node) {
    return switch (node.type()) {
      case MARKDOWN -> "text/markdown";
      case JSON, API -> "application/json";
      default -> "text/html";
    };
  }
}
