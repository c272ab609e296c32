package com.findawise.pointers.infrastructure.persistence;

import com.findawise.pointers.application.port.PointerStorePort;
import com.findawise.pointers.domain.pointer.ContentPointer;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store used when {@code store.type=memory}; contents vanish with the JVM.
 */
public final class InMemoryPointerStore implements PointerStorePort {
  private final Map<String, ContentPointer> pointers = new ConcurrentHashMap<>();

  @Override
  public void save(ContentPointer pointer) {
    Objects.requireNonNull(pointer, "pointer");
    pointers.put(pointer.id(), pointer);
  }

  @Override
  public void delete(String pointerId) {
    pointers.remove(pointerId);
  }

  @Override
  public List<ContentPointer> loadAll() {
    return pointers.values().stream()
        .sorted(Comparator.comparing(ContentPointer::createdAt).thenComparing(ContentPointer::id))
        .toList();
  }
}
