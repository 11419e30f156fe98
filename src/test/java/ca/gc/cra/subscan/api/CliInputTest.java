package ca.gc.cra.subscan.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"domain=example.com", "--Recursive", "-v", "--show-ip", " "});

    assertArrayEquals(new String[] {"domain=example.com"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--recursive"));
    assertTrue(input.hasFlag("--SHOW-IP"));
    assertFalse(input.help());
    assertFalse(input.quiet());
  }

  @Test
  void recognizesHelpAndQuietAliases() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--silent"}).quiet());
    assertTrue(CliInput.parse(new String[] {"-q"}).hasFlag("--quiet"));
  }

  @Test
  void dashPrefixedKeyValueStaysKeyValue() {
    CliInput input = CliInput.parse(new String[] {"--config=scan.yaml"});

    assertArrayEquals(new String[] {"--config=scan.yaml"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void emptyArgsAreHarmless() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag(null));
  }
}
