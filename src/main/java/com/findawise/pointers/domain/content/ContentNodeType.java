package com.findawise.pointers.domain.content;

import java.util.Locale;

/** Kind of content held by the content store. */
public enum ContentNodeType {
  ARTICLE,
  VIDEO,
  QUIZ,
  TOOL,
  PRODUCT,
  COURSE,
  MARKDOWN,
  HTML,
  JSON,
  API,
  REMOTE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ContentNodeType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("content type must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
