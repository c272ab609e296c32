package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.pointer.ContentPointer;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Durable storage behind the pointer registry.
 * <p><strong>Why:</strong> The registry keeps every pointer in memory for fast lookups and writes each
 * mutation through this port so the pointer set survives restarts.</p>
 * <p><strong>Role:</strong> Implemented by {@code InMemoryPointerStore} and {@code JsonFilePointerStore}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls for different ids; the
 * registry serializes calls for the same id.</p>
 *
 * @since 0.1.0
 */
public interface PointerStorePort extends AutoCloseable {
  /**
   * Inserts or replaces a pointer.
   *
   * @param pointer pointer to persist
   * @throws IOException when the write fails
   */
  void save(ContentPointer pointer) throws IOException;

  /**
   * Removes a pointer; unknown ids are ignored.
   *
   * @param pointerId id to remove
   * @throws IOException when the delete fails
   */
  void delete(String pointerId) throws IOException;

  /**
   * Loads every stored pointer.
   *
   * @return stored pointers in no particular order
   * @throws IOException when the store cannot be read
   */
  List<ContentPointer> loadAll() throws IOException;

  @Override
  default void close() throws Exception {}
}
