package com.findawise.pointers.infrastructure.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.domain.error.ContentFetchException;
import com.findawise.pointers.domain.fetch.RetrievedContent;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DynamicContentRetrieverTest {
  @Test
  void placeholderGeneratorEscapesTarget() {
    RetrievedContent content = new DynamicContentRetriever(new PlaceholderContentGenerator())
        .retrieve(pointer("<b>quiz</b>", PointerType.DYNAMIC));

    assertEquals("<p>Dynamic content for &lt;b&gt;quiz&lt;/b&gt;</p>", content.content());
    assertEquals("dynamic", content.source());
  }

  @Test
  void nullGeneratorOutputFails() {
    DynamicContentRetriever retriever = new DynamicContentRetriever(pointer -> null);

    assertThrows(ContentFetchException.class, () -> retriever.retrieve(pointer("x", PointerType.DYNAMIC)));
  }

  @Test
  void unconfiguredTransportNamesPointerType() {
    ContentFetchException ex = assertThrows(ContentFetchException.class,
        () -> new UnconfiguredTransportRetriever().retrieve(pointer("https://api.example.org", PointerType.API)));

    assertTrue(ex.getMessage().contains("api"));
  }

  private static ContentPointer pointer(String target, PointerType type) {
    Instant now = Instant.parse("2024-01-01T00:00:00Z");
    return ContentPointer.builder()
        .id("p-1").sourceId("page").targetId(target).pointerType(type)
        .createdAt(now).updatedAt(now).build();
  }
}
