package com.findawise.pointers.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void laterDuplicatesWinAndOrderIsKept() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"batchSize=10", " format = json ", "batchSize=25", "empty="});

    assertEquals(List.of("batchSize", "format", "empty"), List.copyOf(map.keySet()));
    assertEquals("25", map.get("batchSize"));
    assertEquals("json", map.get("format"));
    assertEquals("", map.get("empty"));
  }

  @Test
  void rejectsTokensWithoutKey() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"verbose"}));
    assertTrue(ex.getMessage().contains("key=value"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsInvalidKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"store dir=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"name=a\u0007b"}));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
