/**
 * Bundled {@link com.findawise.pointers.application.port.ContentRetriever} implementations, one per
 * pointer type family.
 */
package com.findawise.pointers.infrastructure.retrieval;
