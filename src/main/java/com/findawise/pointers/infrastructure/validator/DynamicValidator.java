package com.findawise.pointers.infrastructure.validator;

import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;

/**
 * Generated content always exists once a generator is wired, so dynamic pointers are valid.
 */
public final class DynamicValidator implements PointerValidator {
  @Override
  public ValidationCheck validate(ContentPointer pointer) {
    return ValidationCheck.of(ValidationOutcome.VALID, "Generated on demand");
  }
}
