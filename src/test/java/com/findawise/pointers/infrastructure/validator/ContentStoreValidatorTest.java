package com.findawise.pointers.infrastructure.validator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.content.ContentNodeStatus;
import com.findawise.pointers.domain.content.ContentNodeType;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.content.InMemoryContentNodeStore;
import com.findawise.pointers.infrastructure.retrieval.ContentStoreRetriever.Lookup;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentStoreValidatorTest {
  private InMemoryContentNodeStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryContentNodeStore();
    store.put(node("n-active", "getting-started", ContentNodeStatus.ACTIVE));
    store.put(node("n-pending", "draft-guide", ContentNodeStatus.PENDING));
    store.put(node("n-archived", "old-guide", ContentNodeStatus.ARCHIVED));
    store.put(node("n-inactive", "hidden-guide", ContentNodeStatus.INACTIVE));
    store.put(node("n-broken", "broken-guide", ContentNodeStatus.BROKEN));
  }

  @Test
  void slugStatusesMapToOutcomes() {
    ContentStoreValidator validator = new ContentStoreValidator(store, Lookup.SLUG);

    assertEquals(ValidationOutcome.VALID, validator.validate(slug("getting-started")).outcome());
    assertEquals(ValidationOutcome.VALID, validator.validate(slug("draft-guide")).outcome());
    assertEquals(ValidationOutcome.EXPIRED, validator.validate(slug("old-guide")).outcome());
    assertEquals(ValidationOutcome.BROKEN, validator.validate(slug("hidden-guide")).outcome());
    assertEquals(ValidationOutcome.BROKEN, validator.validate(slug("broken-guide")).outcome());
    assertEquals(ValidationOutcome.NOT_FOUND, validator.validate(slug("nowhere")).outcome());
  }

  @Test
  void retiredSlugWithAliasIsRedirected() {
    store.alias("getting-started-v1", "getting-started");
    ContentStoreValidator validator = new ContentStoreValidator(store, Lookup.SLUG);

    ValidationCheck check = validator.validate(slug("getting-started-v1"));

    assertEquals(ValidationOutcome.REDIRECTED, check.outcome());
    assertEquals("getting-started", check.redirectTarget());
  }

  @Test
  void idLookupIgnoresSlugAliases() {
    store.alias("n-gone", "getting-started");
    ContentStoreValidator validator = new ContentStoreValidator(store, Lookup.ID);

    assertEquals(ValidationOutcome.VALID, validator.validate(id("n-active")).outcome());
    assertEquals(ValidationOutcome.NOT_FOUND, validator.validate(id("n-gone")).outcome());
    assertEquals(ValidationOutcome.NOT_FOUND, validator.validate(id("getting-started")).outcome());
  }

  private static ContentNode node(String id, String slug, ContentNodeStatus status) {
    return new ContentNode(id, ContentNodeType.ARTICLE, id, "", "<p>" + id + "</p>", slug, null,
        null, null, "en", status, 0.8, 1.0, null);
  }

  private static ContentPointer slug(String target) {
    return pointer(target, PointerType.SLUG);
  }

  private static ContentPointer id(String target) {
    return pointer(target, PointerType.ID);
  }

  private static ContentPointer pointer(String target, PointerType type) {
    Instant now = Instant.parse("2024-01-01T00:00:00Z");
    return ContentPointer.builder()
        .id("p-" + target).sourceId("page").targetId(target).pointerType(type)
        .createdAt(now).updatedAt(now).build();
  }
}
