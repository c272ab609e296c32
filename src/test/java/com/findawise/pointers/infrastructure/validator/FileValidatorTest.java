package com.findawise.pointers.infrastructure.validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.pointer.PointerType;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import com.findawise.pointers.infrastructure.retrieval.FileSandbox;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileValidatorTest {
  @TempDir Path root;

  @Test
  void existingFileIsValid() throws Exception {
    Files.createDirectories(root.resolve("docs"));
    Files.writeString(root.resolve("docs/intro.md"), "# Intro");
    FileValidator validator = new FileValidator(new FileSandbox(root));

    assertEquals(ValidationOutcome.VALID, validator.validate(file("docs/intro.md")).outcome());
    assertEquals(ValidationOutcome.VALID, validator.validate(file("/docs/intro.md")).outcome());
  }

  @Test
  void missingFileIsNotFoundAndDirectoryIsBroken() throws Exception {
    Files.createDirectories(root.resolve("docs"));
    FileValidator validator = new FileValidator(new FileSandbox(root));

    assertEquals(ValidationOutcome.NOT_FOUND, validator.validate(file("docs/missing.md")).outcome());
    assertEquals(ValidationOutcome.BROKEN, validator.validate(file("docs")).outcome());
  }

  @Test
  void traversalOutsideRootIsForbidden() {
    FileValidator validator = new FileValidator(new FileSandbox(root.resolve("content")));

    assertEquals(ValidationOutcome.FORBIDDEN, validator.validate(file("../secrets.txt")).outcome());
    assertEquals(ValidationOutcome.FORBIDDEN, validator.validate(file("a/../../secrets.txt")).outcome());
  }

  @Test
  void symlinkToFileOutsideRootIsForbidden(@TempDir Path outside) throws Exception {
    Path content = Files.createDirectories(root.resolve("content"));
    Path secret = Files.writeString(outside.resolve("secret.txt"), "secret");
    boolean linked;
    try {
      Files.createSymbolicLink(content.resolve("notes.md"), secret);
      linked = true;
    } catch (IOException | UnsupportedOperationException ex) {
      linked = false;
    }
    assumeTrue(linked, "symbolic links unsupported");
    FileValidator validator = new FileValidator(new FileSandbox(content));

    assertEquals(ValidationOutcome.FORBIDDEN, validator.validate(file("notes.md")).outcome());
  }

  private static ContentPointer file(String target) {
    Instant now = Instant.parse("2024-01-01T00:00:00Z");
    return ContentPointer.builder()
        .id("p-file").sourceId("page").targetId(target).pointerType(PointerType.FILE)
        .createdAt(now).updatedAt(now).build();
  }
}
