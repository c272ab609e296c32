package com.findawise.pointers.domain.relationship;

/**
 * Options for relationship detection.
 *
 * @param maxSuggestions maximum suggestions returned, positive
 * @param minConfidence suggestions below this confidence are dropped
 * @param includeExternalScorer consult the external relevance scorer when one is configured
 * @param excludeExisting drop targets the source already points to
 * @since 0.1.0
 */
public record DetectionOptions(
    int maxSuggestions, double minConfidence, boolean includeExternalScorer, boolean excludeExisting) {

  public DetectionOptions {
    if (maxSuggestions <= 0) {
      throw new IllegalArgumentException("maxSuggestions must be positive");
    }
    if (minConfidence < 0.0 || minConfidence > 1.0) {
      throw new IllegalArgumentException("minConfidence must be between 0 and 1");
    }
  }

  public static DetectionOptions defaults() {
    return new DetectionOptions(10, 0.3, false, true);
  }

  public DetectionOptions withMaxSuggestions(int value) {
    return new DetectionOptions(value, minConfidence, includeExternalScorer, excludeExisting);
  }

  public DetectionOptions withMinConfidence(double value) {
    return new DetectionOptions(maxSuggestions, value, includeExternalScorer, excludeExisting);
  }

  public DetectionOptions withExternalScorer(boolean value) {
    return new DetectionOptions(maxSuggestions, minConfidence, value, excludeExisting);
  }

  public DetectionOptions withExcludeExisting(boolean value) {
    return new DetectionOptions(maxSuggestions, minConfidence, includeExternalScorer, value);
  }
}
