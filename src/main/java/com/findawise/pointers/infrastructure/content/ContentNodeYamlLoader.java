package com.findawise.pointers.infrastructure.content;

import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.content.ContentNodeStatus;
import com.findawise.pointers.domain.content.ContentNodeType;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a content catalog from YAML into an {@link InMemoryContentNodeStore}.
 *
 * <pre>
 * nodes:
 *   - id: a1
 *     type: article
 *     slug: intro-to-budgeting
 *     tags: [finance, budgeting]
 * aliases:
 *   old-slug: intro-to-budgeting
 * </pre>
 */
public final class ContentNodeYamlLoader {
  private static final Logger log = LoggerFactory.getLogger(ContentNodeYamlLoader.class);

  /**
   * Reads the catalog file.
   *
   * @param path YAML file
   * @return populated store
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed
   */
  public InMemoryContentNodeStore load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      InMemoryContentNodeStore store = parse(reader, path.toString());
      log.info("Loaded {} content nodes from {}", store.listAll().size(), path);
      return store;
    }
  }

  InMemoryContentNodeStore parse(Reader reader, String origin) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid content catalog YAML in " + origin, ex);
    }
    InMemoryContentNodeStore store = new InMemoryContentNodeStore();
    if (document == null) {
      return store;
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Content catalog " + origin + " must be a mapping");
    }
    if (root.get("nodes") instanceof List<?> nodes) {
      for (Object entry : nodes) {
        if (!(entry instanceof Map<?, ?> map)) {
          throw new IllegalArgumentException("Content node entries in " + origin + " must be mappings");
        }
        store.put(toNode(map));
      }
    } else if (root.get("nodes") != null) {
      throw new IllegalArgumentException("'nodes' in " + origin + " must be a list");
    }
    if (root.get("aliases") instanceof Map<?, ?> aliases) {
      aliases.forEach((from, to) -> store.alias(String.valueOf(from), String.valueOf(to)));
    }
    return store;
  }

  private static ContentNode toNode(Map<?, ?> map) {
    Object id = map.get("id");
    if (id == null || id.toString().isBlank()) {
      throw new IllegalArgumentException("Content node is missing 'id'");
    }
    Object status = map.get("status");
    return new ContentNode(
        id.toString(),
        ContentNodeType.fromWire(text(map, "type", "article")),
        text(map, "title", ""),
        text(map, "description", ""),
        text(map, "content", ""),
        text(map, "slug", null),
        text(map, "url", null),
        strings(map.get("tags")),
        strings(map.get("categories")),
        text(map, "language", null),
        status == null ? ContentNodeStatus.ACTIVE : ContentNodeStatus.valueOf(status.toString().trim().toUpperCase(Locale.ROOT)),
        number(map.get("qualityScore"), 0.5),
        number(map.get("securityScore"), 1.0),
        doubles(map.get("embeddings")));
  }

  private static String text(Map<?, ?> map, String key, String defaultValue) {
    Object value = map.get(key);
    return value == null ? defaultValue : value.toString();
  }

  private static List<String> strings(Object value) {
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<String> result = new ArrayList<>(list.size());
    for (Object item : list) {
      if (item != null) {
        result.add(item.toString());
      }
    }
    return result;
  }

  private static List<Double> doubles(Object value) {
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<Double> result = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof Number number)) {
        throw new IllegalArgumentException("embeddings must be numeric");
      }
      result.add(number.doubleValue());
    }
    return result;
  }

  private static double number(Object value, double defaultValue) {
    return value instanceof Number number ? number.doubleValue() : defaultValue;
  }
}
