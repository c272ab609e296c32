package com.findawise.pointers.application.port;

import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.validation.ValidationCheck;

/**
 * Reachability check for one pointer type.
 *
 * <p>An unreachable target is reported as an outcome, not an exception. Throwing
 * {@link com.findawise.pointers.domain.error.PointerValidationException} (or any runtime exception) means the
 * check itself could not run, and the pointer keeps its current status.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PointerValidator {
  ValidationCheck validate(ContentPointer pointer);
}
