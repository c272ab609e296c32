package com.findawise.pointers.infrastructure.validator;

import com.findawise.pointers.application.port.ContentNodeSource;
import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.retrieval.ContentStoreRetriever;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks {@code slug} and {@code id} pointers against the content store.
 *
 * <p>Node status maps to outcomes: active or pending nodes are {@code valid}, archived nodes
 * {@code expired}, inactive or broken nodes {@code broken}. A missing slug with a stored alias is
 * {@code redirected}; anything else missing is {@code not_found}.
 */
public final class ContentStoreValidator implements PointerValidator {
  private final ContentNodeSource nodes;
  private final ContentStoreRetriever.Lookup lookup;

  public ContentStoreValidator(ContentNodeSource nodes, ContentStoreRetriever.Lookup lookup) {
    this.nodes = Objects.requireNonNull(nodes, "nodes");
    this.lookup = Objects.requireNonNull(lookup, "lookup");
  }

  @Override
  public ValidationCheck validate(ContentPointer pointer) {
    String target = pointer.targetId();
    Optional<ContentNode> node = lookup == ContentStoreRetriever.Lookup.SLUG
        ? nodes.findBySlug(target)
        : nodes.findById(target);
    if (node.isEmpty()) {
      if (lookup == ContentStoreRetriever.Lookup.SLUG) {
        Optional<String> alias = nodes.redirectFor(target);
        if (alias.isPresent()) {
          return ValidationCheck.redirected(alias.get());
        }
      }
      return ValidationCheck.of(ValidationOutcome.NOT_FOUND, "No content for " + target);
    }
    ContentNode found = node.get();
    return switch (found.status()) {
      case ACTIVE, PENDING -> ValidationCheck.of(ValidationOutcome.VALID);
      case ARCHIVED -> ValidationCheck.of(ValidationOutcome.EXPIRED, "Content " + found.id() + " is archived");
      case INACTIVE, BROKEN -> ValidationCheck.of(
          ValidationOutcome.BROKEN, "Content " + found.id() + " is " + found.status().name().toLowerCase(Locale.ROOT));
    };
  }
}
