package com.findawise.pointers.application.relationship;

import com.findawise.pointers.domain.pointer.RelationshipType;
import com.findawise.pointers.domain.relationship.ConditionOperator;
import com.findawise.pointers.domain.relationship.PatternCondition;
import com.findawise.pointers.domain.relationship.PatternType;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads relationship patterns from YAML documents.
 *
 * <pre>
 * version: 1
 * patterns:
 *   - id: same-category-related
 *     type: contextual
 *     relationship: related
 *     strength: 0.6
 *     conditions:
 *       - { field: categories, operator: contains, value: "${source.categories}", weight: 1.0 }
 * </pre>
 *
 * @since 0.1.0
 */
public final class RelationshipPatternLoader {
  /** Classpath resource holding the bundled patterns. */
  public static final String DEFAULT_RESOURCE = "/relationship-patterns.yaml";

  /**
   * Loads patterns from a file.
   *
   * @param path YAML file
   * @return parsed patterns in document order
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the document is malformed
   */
  public List<RelationshipPattern> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Pattern file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Loads the bundled pattern set from the classpath.
   *
   * @return parsed patterns; empty when the resource is absent
   * @throws IOException when the resource cannot be read
   */
  public List<RelationshipPattern> loadDefaults() throws IOException {
    try (InputStream in = RelationshipPatternLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        return List.of();
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
    }
  }

  List<RelationshipPattern> parse(Reader reader, String origin) {
    Object rootObj;
    try {
      rootObj = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML patterns at " + origin, ex);
    }
    if (rootObj == null) {
      return List.of();
    }
    Map<String, Object> root = asMap(rootObj, "root");
    int version = toInt(root.get("version"), "version");
    if (version != 1) {
      throw new IllegalArgumentException("Unsupported pattern version " + version + " in " + origin);
    }
    List<RelationshipPattern> patterns = new ArrayList<>();
    Set<String> ids = new LinkedHashSet<>();
    Object patternsNode = root.get("patterns");
    if (patternsNode instanceof Iterable<?> iterable) {
      for (Object node : iterable) {
        RelationshipPattern pattern = parsePattern(asMap(node, "pattern"));
        if (!ids.add(pattern.id())) {
          throw new IllegalArgumentException("Duplicate pattern id detected: " + pattern.id());
        }
        patterns.add(pattern);
      }
    } else if (patternsNode != null) {
      throw new IllegalArgumentException("patterns must be a list");
    }
    return List.copyOf(patterns);
  }

  private RelationshipPattern parsePattern(Map<String, Object> map) {
    String id = requireString(map, "id");
    PatternType type = PatternType.fromWire(requireString(map, "type"));
    RelationshipType relationship = RelationshipType.fromWire(requireString(map, "relationship"));
    String description = map.get("description") == null ? "" : map.get("description").toString();
    double strength = toDouble(map.get("strength"), "strength", 0.5);
    long usageCount = (long) toDouble(map.get("usageCount"), "usageCount", 0);
    double successRate = toDouble(map.get("successRate"), "successRate", 0.0);

    List<PatternCondition> conditions = new ArrayList<>();
    Object conditionsNode = map.get("conditions");
    if (!(conditionsNode instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException("pattern " + id + " must declare a conditions list");
    }
    for (Object node : iterable) {
      Map<String, Object> condition = asMap(node, "condition");
      conditions.add(new PatternCondition(
          requireString(condition, "field"),
          ConditionOperator.fromWire(requireString(condition, "operator")),
          condition.get("value") == null ? "" : condition.get("value").toString(),
          toDouble(condition.get("weight"), "weight", 1.0)));
    }
    return new RelationshipPattern(
        id, type, relationship, description, strength, conditions, usageCount, successRate, 0L);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Missing required field '" + key + "'");
    }
    return value.toString().trim();
  }

  private static int toInt(Object value, String field) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(field + " must be an integer", ex);
      }
    }
    throw new IllegalArgumentException(field + " must be an integer");
  }

  private static double toDouble(Object value, String field, double defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(field + " must be numeric", ex);
    }
  }
}
