package io.flightqc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireEnvNameAcceptsConventionalNames() {
    assertEquals("FLIGHTQC_SECRET", Strings.requireEnvName("secretEnv", "FLIGHTQC_SECRET"));
  }

  @Test
  void requireEnvNameRejectsLeadingDigitAndPunctuation() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvName("secretEnv", "1SECRET"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvName("secretEnv", "MY-SECRET"));
  }

  @Test
  void splitListTrimsLowerCasesAndSkipsEmptyTokens() {
    assertEquals(List.of("jpg", "jpeg", "dng"), Strings.splitList("extensions", " JPG, jpeg,, Dng ", true));
  }

  @Test
  void splitListPreservesCaseWhenAsked() {
    assertEquals(List.of("xmp:drone-dji:RelativeAltitude", "gps"),
        Strings.splitList("precedence", "xmp:drone-dji:RelativeAltitude,gps", false));
  }

  @Test
  void splitListRejectsOnlySeparators() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.splitList("extensions", " , ,", true));
    assertEquals("extensions must list at least one value", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("user", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("user", "abc", 2));
  }
}
