package com.findawise.pointers.domain.content;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a content entity owned by the content store.
 *
 * @param id store identifier
 * @param type content kind
 * @param title display title
 * @param description short summary
 * @param content body; may be empty for remote content
 * @param slug URL slug; may be {@code null}
 * @param url canonical URL; may be {@code null}
 * @param tags classification tags
 * @param categories editorial categories
 * @param language language code; may be {@code null}
 * @param status publication status
 * @param qualityScore editorial quality in {@code [0,1]}
 * @param securityScore trust score in {@code [0,1]}
 * @param embeddings vector representation; empty when the store has none
 * @since 0.1.0
 */
public record ContentNode(
    String id,
    ContentNodeType type,
    String title,
    String description,
    String content,
    String slug,
    String url,
    List<String> tags,
    List<String> categories,
    String language,
    ContentNodeStatus status,
    double qualityScore,
    double securityScore,
    List<Double> embeddings) {

  public ContentNode {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    title = title == null ? "" : title;
    description = description == null ? "" : description;
    content = content == null ? "" : content;
    tags = tags == null ? List.of() : List.copyOf(tags);
    categories = categories == null ? List.of() : List.copyOf(categories);
    status = status == null ? ContentNodeStatus.ACTIVE : status;
    embeddings = embeddings == null ? List.of() : List.copyOf(embeddings);
  }

  public boolean hasEmbeddings() {
    return !embeddings.isEmpty();
  }
}
