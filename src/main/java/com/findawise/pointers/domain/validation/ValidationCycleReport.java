package com.findawise.pointers.domain.validation;

import com.findawise.pointers.domain.pointer.ValidationStatus;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one validation cycle.
 *
 * @param attempted queue entries picked up by the cycle
 * @param batches number of batches executed
 * @param statusCounts applied results grouped by resulting status
 * @param errors validator executions that failed and left the status unchanged
 * @param staleDiscards results dropped because the pointer was retargeted or deleted mid-flight
 * @param durationMillis wall time of the cycle
 * @since 0.1.0
 */
public record ValidationCycleReport(
    int attempted,
    int batches,
    Map<ValidationStatus, Integer> statusCounts,
    int errors,
    int staleDiscards,
    long durationMillis) {

  public ValidationCycleReport {
    EnumMap<ValidationStatus, Integer> copy = new EnumMap<>(ValidationStatus.class);
    if (statusCounts != null) {
      copy.putAll(statusCounts);
    }
    statusCounts = Map.copyOf(copy);
  }

  public static ValidationCycleReport empty() {
    return new ValidationCycleReport(0, 0, Map.of(), 0, 0, 0L);
  }

  public int count(ValidationStatus status) {
    return statusCounts.getOrDefault(status, 0);
  }

  public int applied() {
    return statusCounts.values().stream().mapToInt(Integer::intValue).sum();
  }
}
