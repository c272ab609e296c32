package com.findawise.pointers.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by commands that mix bare flags with {@code key=value} settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the configuration path from {@code args}.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  static OutputFormat parseFormat(Map<String, String> map) {
    String value = map == null ? null : map.get("format");
    if (value == null || value.isBlank()) {
      return OutputFormat.TEXT;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> OutputFormat.TEXT;
      case "json" -> OutputFormat.JSON;
      default -> throw new IllegalArgumentException("format must be text or json (was " + value + ")");
    };
  }

  /** Rendering used by the reporting commands. */
  enum OutputFormat {
    TEXT,
    JSON
  }
}
