package com.findawise.pointers.application.pointer;

import com.findawise.pointers.domain.pointer.PointerType;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Gate applied to pointers on creation and on critical updates.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>A domain on the deny list is rejected. Entries match exactly or, written as {@code *.example.com},
 *   any subdomain and the apex.</li>
 *   <li>A URL target carrying a script-execution scheme ({@code javascript:}, {@code vbscript:}) is rejected.</li>
 *   <li>A URL target carrying an inline {@code data:} payload is allowed with a warning.</li>
 * </ul>
 * <p>Allow-list membership never rejects; it marks a domain as trusted for analytics.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class PointerSecurityFilter {
  /** Deny list applied when configuration supplies none. */
  public static final List<String> DEFAULT_DENY = List.of("spam.com", "malware.site", "phishing.net");
  /** Allow list applied when configuration supplies none. */
  public static final List<String> DEFAULT_ALLOW = List.of(
      "*.findawise.com", "*.replit.app", "github.com", "docs.google.com", "youtube.com", "vimeo.com");

  private static final List<String> SCRIPT_SCHEMES = List.of("javascript:", "vbscript:");
  private static final String DATA_SCHEME = "data:";

  private final List<String> denyDomains;
  private final List<String> allowDomains;

  public PointerSecurityFilter(Collection<String> denyDomains, Collection<String> allowDomains) {
    this.denyDomains = normalize(denyDomains);
    this.allowDomains = normalize(allowDomains);
  }

  public static PointerSecurityFilter defaults() {
    return new PointerSecurityFilter(DEFAULT_DENY, DEFAULT_ALLOW);
  }

  /**
   * Evaluates a pointer's target binding.
   *
   * @param pointerType pointer type
   * @param targetId target locator
   * @param domain declared domain; when absent the host of a URL target is used
   * @return verdict holding every rejection reason and warning
   */
  public Verdict check(PointerType pointerType, String targetId, String domain) {
    Objects.requireNonNull(pointerType, "pointerType");
    List<String> rejections = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    Optional<String> effectiveDomain = effectiveDomain(pointerType, targetId, domain);
    effectiveDomain
        .filter(this::isDenied)
        .ifPresent(d -> rejections.add("Domain is blacklisted: " + d));

    if (pointerType == PointerType.URL && targetId != null) {
      String normalized = normalizeTarget(targetId);
      for (String scheme : SCRIPT_SCHEMES) {
        if (normalized.contains(scheme)) {
          rejections.add("Script URLs are not allowed: " + scheme);
        }
      }
      if (normalized.contains(DATA_SCHEME)) {
        warnings.add("Data URLs should be used with caution");
      }
    }
    return new Verdict(rejections, warnings);
  }

  public boolean isDenied(String domain) {
    return matchesAny(denyDomains, domain);
  }

  /**
   * Reports whether a domain is on the allow list.
   *
   * @param domain host name; {@code null} is never trusted
   * @return {@code true} when trusted
   */
  public boolean isTrusted(String domain) {
    return matchesAny(allowDomains, domain);
  }

  static boolean matches(String pattern, String domain) {
    if (pattern.startsWith("*.")) {
      String apex = pattern.substring(2);
      return domain.equals(apex) || domain.endsWith("." + apex);
    }
    return domain.equals(pattern);
  }

  private static boolean matchesAny(List<String> patterns, String domain) {
    if (domain == null || domain.isBlank()) {
      return false;
    }
    String normalized = domain.trim().toLowerCase(Locale.ROOT);
    for (String pattern : patterns) {
      if (matches(pattern, normalized)) {
        return true;
      }
    }
    return false;
  }

  private static Optional<String> effectiveDomain(PointerType type, String targetId, String domain) {
    if (domain != null && !domain.isBlank()) {
      return Optional.of(domain.trim().toLowerCase(Locale.ROOT));
    }
    if (type != PointerType.URL || targetId == null) {
      return Optional.empty();
    }
    try {
      String host = new URI(targetId.trim()).getHost();
      return host == null ? Optional.empty() : Optional.of(host.toLowerCase(Locale.ROOT));
    } catch (URISyntaxException ex) {
      return Optional.empty();
    }
  }

  private static String normalizeTarget(String targetId) {
    StringBuilder sb = new StringBuilder(targetId.length());
    for (int i = 0; i < targetId.length(); i++) {
      char c = targetId.charAt(i);
      if (!Character.isWhitespace(c) && !Character.isISOControl(c)) {
        sb.append(c);
      }
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }

  private static List<String> normalize(Collection<String> domains) {
    if (domains == null) {
      return List.of();
    }
    List<String> result = new ArrayList<>();
    for (String domain : domains) {
      if (domain != null && !domain.isBlank()) {
        result.add(domain.trim().toLowerCase(Locale.ROOT));
      }
    }
    return List.copyOf(result);
  }

  /**
   * Result of a security check.
   *
   * @param rejections reasons the pointer must be refused; empty when allowed
   * @param warnings non-blocking concerns
   */
  public record Verdict(List<String> rejections, List<String> warnings) {
    public Verdict {
      rejections = List.copyOf(rejections);
      warnings = List.copyOf(warnings);
    }

    public boolean allowed() {
      return rejections.isEmpty();
    }
  }
}
