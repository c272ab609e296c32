package com.findawise.pointers.validation;

/**
 * Numeric range checks for configuration values and pointer scores.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value lies in an inclusive range.
   *
   * @param name parameter name used in messages
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a score in {@code [0,1]}.
   *
   * @param name parameter name used in messages
   * @param value candidate score
   * @return {@code value}
   * @throws IllegalArgumentException if the value is NaN or outside {@code [0,1]}
   */
  public static double requireUnitInterval(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(label(name) + " must be between 0 and 1 (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
