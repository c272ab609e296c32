package com.findawise.pointers.domain.pointer;

/**
 * Engagement counters maintained by external callers through pointer updates.
 *
 * @param clicks number of clicks on the pointer
 * @param conversions number of conversions attributed to the pointer
 * @param bounceRate bounce rate in {@code [0,1]}
 * @param avgTimeOnContentSeconds average dwell time on the target
 * @since 0.1.0
 */
public record PointerAnalytics(long clicks, long conversions, double bounceRate, double avgTimeOnContentSeconds) {
  public static final PointerAnalytics EMPTY = new PointerAnalytics(0, 0, 0.0, 0.0);
}
