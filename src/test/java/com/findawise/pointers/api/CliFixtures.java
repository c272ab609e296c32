package com.findawise.pointers.api;

import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.infrastructure.persistence.JsonFilePointerStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/** Writes a small content catalog and a pending pointer set for the command tests. */
final class CliFixtures {
  private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

  private CliFixtures() {}

  static Path writeCatalog(Path dir) throws IOException {
    Path file = dir.resolve("nodes.yaml");
    Files.writeString(file, String.join("\n",
        "nodes:",
        "  - id: a1",
        "    type: article",
        "    slug: intro",
        "    content: <p>Intro</p>",
        "  - id: q1",
        "    type: quiz",
        "    slug: quiz-old",
        "    status: archived",
        "aliases:",
        "  budgeting-101: intro",
        ""));
    return file;
  }

  /**
   * Stores six pending pointers: three resolve, one is missing, one points at archived content and
   * one uses a retired slug. Two share the {@code intro} target.
   */
  static Path writeStore(Path dir) throws IOException {
    Path storeDir = dir.resolve("store");
    JsonFilePointerStore store = new JsonFilePointerStore(storeDir, null);
    store.save(pointer("p-valid", "intro", PointerType.SLUG, 0));
    store.save(pointer("p-dup", "intro", PointerType.SLUG, 1));
    store.save(pointer("p-url", "https://docs.example.org/guide", PointerType.URL, 2));
    store.save(pointer("p-missing", "nowhere", PointerType.SLUG, 3));
    store.save(pointer("p-expired", "quiz-old", PointerType.SLUG, 4));
    store.save(pointer("p-redirect", "budgeting-101", PointerType.SLUG, 5));
    return storeDir;
  }

  static String[] args(Path storeDir, Path catalog, String... extra) {
    String[] base = {
        "store.directory=" + storeDir,
        "content.nodesFile=" + catalog,
        "metricsExporter=none"};
    String[] all = new String[base.length + extra.length];
    System.arraycopy(base, 0, all, 0, base.length);
    System.arraycopy(extra, 0, all, base.length, extra.length);
    return all;
  }

  private static ContentPointer pointer(String id, String target, PointerType type, int offsetSeconds) {
    Instant at = CREATED.plusSeconds(offsetSeconds);
    return ContentPointer.builder()
        .id(id)
        .sourceId("page")
        .targetId(target)
        .pointerType(type)
        .createdAt(at)
        .updatedAt(at)
        .build();
  }
}
