package com.findawise.pointers.infrastructure.validator;

import com.findawise.pointers.application.port.PointerValidator;
import com.findawise.pointers.domain.pointer.ContentPointer;
import com.findawise.pointers.domain.validation.ValidationCheck;
import com.findawise.pointers.domain.validation.ValidationOutcome;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Validates {@code url} and {@code api} targets structurally: an absolute http(s) URI with a host.
 * Reachability is not probed until a transport adapter replaces this validator.
 */
public final class UrlSyntaxValidator implements PointerValidator {
  @Override
  public ValidationCheck validate(ContentPointer pointer) {
    URI uri;
    try {
      uri = new URI(pointer.targetId().strip());
    } catch (URISyntaxException ex) {
      return ValidationCheck.of(ValidationOutcome.BROKEN, "Malformed URL: " + ex.getReason());
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      return ValidationCheck.of(ValidationOutcome.BROKEN, "Unsupported scheme: " + (scheme.isEmpty() ? "<none>" : scheme));
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      return ValidationCheck.of(ValidationOutcome.BROKEN, "URL has no host");
    }
    return ValidationCheck.of(ValidationOutcome.VALID, "Well-formed; reachability not checked");
  }
}
