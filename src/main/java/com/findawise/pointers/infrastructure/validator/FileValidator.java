package com.findawise.pointers.infrastructure.validator;

import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.retrieval.FileSandbox;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks {@code file} pointers inside the content root.
 */
public final class FileValidator implements PointerValidator {
  private final FileSandbox sandbox;

  public FileValidator(FileSandbox sandbox) {
    this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
  }

  @Override
  public ValidationCheck validate(ContentPointer pointer) {
    Optional<Path> resolved = sandbox.resolve(pointer.targetId());
    if (resolved.isEmpty()) {
      return ValidationCheck.of(ValidationOutcome.FORBIDDEN, "Target escapes content root");
    }
    Path file = resolved.get();
    if (!Files.exists(file)) {
      return ValidationCheck.of(ValidationOutcome.NOT_FOUND, "No file at " + pointer.targetId());
    }
    if (!Files.isRegularFile(file)) {
      return ValidationCheck.of(ValidationOutcome.BROKEN, pointer.targetId() + " is not a regular file");
    }
    if (!Files.isReadable(file)) {
      return ValidationCheck.of(ValidationOutcome.FORBIDDEN, pointer.targetId() + " is not readable");
    }
    return ValidationCheck.of(ValidationOutcome.VALID);
  }
}
