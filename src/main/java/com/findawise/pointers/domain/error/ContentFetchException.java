package com.findawise.pointers.domain.error;

/**
 * Raised by retrievers when a target cannot be resolved. The fetcher converts it into a failed
 * or fallback {@code FetchResult}.
 */
public final class ContentFetchException extends PointerEngineException {
  private static final long serialVersionUID = 1L;

  public ContentFetchException(String message) {
    super(message);
  }

  public ContentFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
