/**
 * Bundled {@link com.findawise.pointers.application.port.PointerValidator} implementations.
 * <p>Validators report a raw {@link com.findawise.pointers.domain.validation.ValidationOutcome};
 * the validation service maps it onto the persisted status.</p>
 */
package com.findawise.pointers.infrastructure.validator;
