package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.content.ContentNode;
import com.findawise.pointers.domain.relationship.RelationshipSuggestion;
import java.util.List;

/**
 * External relevance service that proposes relationships, typically backed by a hosted model.
 *
 * <p>Failures are tolerated by the detector: an exception here drops this source of suggestions for the
 * call and nothing else.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RelevanceScorer {
  List<RelationshipSuggestion> suggest(ContentNode source, List<ContentNode> candidates);
}
