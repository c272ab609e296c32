package com.findawise.pointers.domain.pointer;

import java.util.List;
import java.util.Locale;

/**
 * Descriptive attributes attached to a pointer.
 *
 * @param context free-form placement context; never {@code null}
 * @param tags classification tags; immutable copy
 * @param domain host the target lives on, used by the security filter and analytics; may be {@code null}
 * @param contentType expected content type of the target; may be {@code null}
 * @param language language code of the target; may be {@code null}
 * @param quality editorial quality score in {@code [0,1]}; may be {@code null}
 * @param userBehaviorFactor behavioural weighting in {@code [0,1]}
 * @param aiRelevanceScore relevance score supplied by an external scorer in {@code [0,1]}
 * @param cacheKey optional override of the content cache key; may be {@code null}
 * @since 0.1.0
 */
public record PointerMetadata(
    String context,
    List<String> tags,
    String domain,
    String contentType,
    String language,
    Double quality,
    double userBehaviorFactor,
    double aiRelevanceScore,
    String cacheKey) {

  /** Neutral weighting applied when no behavioural or relevance signal exists. */
  public static final double NEUTRAL_SCORE = 0.5;

  public PointerMetadata {
    context = context == null ? "" : context;
    tags = tags == null ? List.of() : List.copyOf(tags);
    domain = domain == null || domain.isBlank() ? null : domain.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns metadata with empty context, no tags and neutral scores.
   *
   * @return default metadata
   */
  public static PointerMetadata defaults() {
    return new PointerMetadata("", List.of(), null, null, null, null, NEUTRAL_SCORE, NEUTRAL_SCORE, null);
  }

  /**
   * Returns a copy bound to the supplied domain.
   *
   * @param newDomain host name; blank clears the domain
   * @return updated metadata
   */
  public PointerMetadata withDomain(String newDomain) {
    return new PointerMetadata(
        context, tags, newDomain, contentType, language, quality, userBehaviorFactor, aiRelevanceScore, cacheKey);
  }
}
