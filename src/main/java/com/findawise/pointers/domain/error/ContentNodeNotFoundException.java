package com.findawise.pointers.domain.error;

/** Raised when relationship detection is asked about a content node the store does not know. */
public final class ContentNodeNotFoundException extends PointerEngineException {
  private static final long serialVersionUID = 1L;

  public ContentNodeNotFoundException(String nodeId) {
    super("Content node not found: " + nodeId);
  }
}
