package com.findawise.pointers.infrastructure.scoring;

import com.findawise.pointers.application.port.SimilarityScorer;
import com.findawise.pointers.domain.content.ContentNode;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cosine similarity over node embeddings, clamped to {@code [0, 1]}.
 *
 * <p>When either node lacks embeddings (or the dimensions differ) the score falls back to the
 * Jaccard overlap of lower-cased tags and categories.
 */
public final class CosineSimilarityScorer implements SimilarityScorer {
  @Override
  public double similarity(ContentNode first, ContentNode second) {
    if (first.hasEmbeddings() && second.hasEmbeddings()
        && first.embeddings().size() == second.embeddings().size()) {
      return cosine(first.embeddings(), second.embeddings());
    }
    return jaccard(labels(first), labels(second));
  }

  static double cosine(List<Double> a, List<Double> b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double score = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return Math.max(0.0, Math.min(1.0, score));
  }

  private static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  private static Set<String> labels(ContentNode node) {
    Set<String> labels = new HashSet<>();
    node.tags().forEach(tag -> labels.add(tag.toLowerCase(Locale.ROOT)));
    node.categories().forEach(category -> labels.add(category.toLowerCase(Locale.ROOT)));
    return labels;
  }
}
