package com.findawise.pointers.application.pointer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.findawise.pointers.domain.pointer.PointerType;
import java.util.List;
import org.junit.jupiter.api.Test;

class PointerSecurityFilterTest {
  private final PointerSecurityFilter filter = PointerSecurityFilter.defaults();

  @Test
  void deniedDomainIsRejectedWhetherDeclaredOrTakenFromUrl() {
    PointerSecurityFilter.Verdict declared = filter.check(PointerType.SLUG, "some-slug", "Spam.com");
    PointerSecurityFilter.Verdict fromUrl = filter.check(PointerType.URL, "https://malware.site/x", null);

    assertFalse(declared.allowed());
    assertEquals(List.of("Domain is blacklisted: spam.com"), declared.rejections());
    assertFalse(fromUrl.allowed());
  }

  @Test
  void scriptSchemesAreRejectedEvenWithEmbeddedWhitespace() {
    PointerSecurityFilter.Verdict verdict = filter.check(PointerType.URL, "java\tscript:alert(1)", null);

    assertFalse(verdict.allowed());
    assertTrue(verdict.rejections().get(0).contains("javascript:"));
  }

  @Test
  void dataUrlsAreAllowedWithWarning() {
    PointerSecurityFilter.Verdict verdict = filter.check(PointerType.URL, "data:text/html,<p>hi</p>", null);

    assertTrue(verdict.allowed());
    assertEquals(List.of("Data URLs should be used with caution"), verdict.warnings());
  }

  @Test
  void schemeChecksOnlyApplyToUrlPointers() {
    assertTrue(filter.check(PointerType.FILE, "docs/javascript:notes.md", null).allowed());
  }

  @Test
  void wildcardAllowListMatchesApexAndSubdomains() {
    assertTrue(filter.isTrusted("findawise.com"));
    assertTrue(filter.isTrusted("blog.findawise.com"));
    assertFalse(filter.isTrusted("notfindawise.com"));
    assertFalse(filter.isTrusted(null));
  }

  @Test
  void wildcardDenyEntryBlocksSubdomains() {
    PointerSecurityFilter custom = new PointerSecurityFilter(List.of("*.bad.example"), List.of());

    assertFalse(custom.check(PointerType.URL, "https://cdn.bad.example/a.js", null).allowed());
    assertTrue(custom.check(PointerType.URL, "https://good.example/", null).allowed());
  }
}
