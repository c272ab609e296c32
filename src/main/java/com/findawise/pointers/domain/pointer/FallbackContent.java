package com.findawise.pointers.domain.pointer;

/**
 * Content served when the primary retrieval of a pointer fails.
 *
 * @param title heading rendered when {@code html} is absent
 * @param description body text rendered when {@code html} is absent
 * @param html preformatted markup; served verbatim when present
 * @since 0.1.0
 */
public record FallbackContent(String title, String description, String html) {
  public FallbackContent {
    title = title == null ? "" : title;
    description = description == null ? "" : description;
  }

  public boolean hasHtml() {
    return html != null && !html.isBlank();
  }
}
