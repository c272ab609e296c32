package com.findawise.pointers.domain.analytics;

import com.findawise.pointers.domain.pointer.ContentPointer;
import java.util.List;

/**
 * Pointers that share the same target.
 *
 * @param targetId shared target
 * @param pointers two or more pointers, ordered by creation time
 * @since 0.1.0
 */
public record DuplicateGroup(String targetId, List<ContentPointer> pointers) {
  public DuplicateGroup {
    pointers = List.copyOf(pointers);
  }

  public int size() {
    return pointers.size();
  }
}
