package com.findawise.pointers.application.relationship;

import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.relationship.PatternCondition;
import com.findawise.pointers.domain.relationship.RelationshipPattern;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates relationship pattern conditions against a source and a candidate node.
 *
 * <p>Node fields are read by name. Text comparisons ignore case; list fields match when any element
 * matches. Numeric operators skip non-numeric values.</p>
 *
 * @since 0.1.0
 */
final class PatternMatcher {
  private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

  private final Map<String, Pattern> regexCache = new ConcurrentHashMap<>();

  /**
   * Returns the weighted share of the pattern's conditions satisfied by the candidate.
   *
   * @param pattern pattern to evaluate
   * @param source source node, used to resolve {@code ${source.field}} references
   * @param candidate candidate target node
   * @return ratio in {@code [0,1]}
   */
  double matchRatio(RelationshipPattern pattern, ContentNode source, ContentNode candidate) {
    double matched = 0.0;
    for (PatternCondition condition : pattern.conditions()) {
      if (matches(condition, source, candidate)) {
        matched += condition.weight();
      }
    }
    double total = pattern.totalWeight();
    return total <= 0.0 ? 0.0 : matched / total;
  }

  boolean matches(PatternCondition condition, ContentNode source, ContentNode candidate) {
    List<String> actual = fieldValues(candidate, condition.field());
    List<String> expected = condition.sourceReference()
        .map(field -> fieldValues(source, field))
        .orElseGet(() -> List.of(condition.value()));
    if (actual.isEmpty() || expected.isEmpty()) {
      return false;
    }
    for (String left : actual) {
      for (String right : expected) {
        if (compare(condition, left, right)) {
          return true;
        }
      }
    }
    return false;
  }

  private boolean compare(PatternCondition condition, String actual, String expected) {
    return switch (condition.operator()) {
      case EQUALS -> actual.equalsIgnoreCase(expected);
      case CONTAINS -> actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
      case MATCHES -> regex(expected).map(p -> p.matcher(actual).find()).orElse(false);
      case GREATER -> compareNumbers(actual, expected) > 0;
      case LESS -> compareNumbers(actual, expected) < 0;
    };
  }

  private Optional<Pattern> regex(String expression) {
    Pattern cached = regexCache.get(expression);
    if (cached != null) {
      return Optional.of(cached);
    }
    try {
      Pattern compiled = Pattern.compile(expression, Pattern.CASE_INSENSITIVE);
      regexCache.putIfAbsent(expression, compiled);
      return Optional.of(compiled);
    } catch (PatternSyntaxException ex) {
      log.debug("Ignoring invalid condition regex '{}': {}", expression, ex.getDescription());
      return Optional.empty();
    }
  }

  private static int compareNumbers(String actual, String expected) {
    try {
      return Double.compare(Double.parseDouble(actual), Double.parseDouble(expected));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  static List<String> fieldValues(ContentNode node, String field) {
    List<String> values = new ArrayList<>();
    switch (field) {
      case "id" -> values.add(node.id());
      case "type" -> values.add(node.type().wireName());
      case "title" -> values.add(node.title());
      case "description" -> values.add(node.description());
      case "content" -> values.add(node.content());
      case "slug" -> addIfPresent(values, node.slug());
      case "url" -> addIfPresent(values, node.url());
      case "language" -> addIfPresent(values, node.language());
      case "status" -> values.add(node.status().name().toLowerCase(Locale.ROOT));
      case "qualityScore" -> values.add(Double.toString(node.qualityScore()));
      case "securityScore" -> values.add(Double.toString(node.securityScore()));
      case "tags" -> values.addAll(node.tags());
      case "categories" -> values.addAll(node.categories());
      default -> log.debug("Unknown content node field '{}' in pattern condition", field);
    }
    values.removeIf(value -> value == null || value.isEmpty());
    return values;
  }

  private static void addIfPresent(List<String> values, String value) {
    if (value != null) {
      values.add(value);
    }
  }
}
