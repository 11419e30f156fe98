package ca.gc.cra.subscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DomainsTest {

  @Test
  void cleanStripsSchemeAndWwwPrefix() {
    assertEquals("example.com", Domains.clean("  https://www.example.com "));
    assertEquals("example.com", Domains.clean("http://example.com"));
    assertEquals("", Domains.clean(null));
  }

  @Test
  void validityChecks() {
    assertTrue(Domains.isValid("example.com"));
    assertTrue(Domains.isValid("sub.example.co.uk"));
    assertFalse(Domains.isValid("localhost"));
    assertFalse(Domains.isValid("example.c"));
    assertFalse(Domains.isValid("example.c0m"));
    assertFalse(Domains.isValid("exa mple.com"));
    assertFalse(Domains.isValid("example.com/path"));
    assertFalse(Domains.isValid(""));
  }

  @Test
  void requireValidLowercases() {
    assertEquals("example.com", Domains.requireValid("domain", "WWW.Example.COM"));
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> Domains.requireValid("domain", "bad"));
    assertEquals("domain is not a valid domain: 'bad'", thrown.getMessage());
  }

  @Test
  void rootHostKeepsLastTwoLabels() {
    assertEquals("example.com", Domains.rootHost("a.b.example.com"));
    assertEquals("example.com", Domains.rootHost("example.com"));
    assertEquals("localhost", Domains.rootHost("localhost"));
    assertEquals("", Domains.rootHost(null));
  }
}
