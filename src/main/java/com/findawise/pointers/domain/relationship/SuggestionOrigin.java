package com.findawise.pointers.domain.relationship;

/** Candidate generator that produced a suggestion. */
public enum SuggestionOrigin {
  PATTERN,
  SIMILARITY,
  EXTERNAL
}
