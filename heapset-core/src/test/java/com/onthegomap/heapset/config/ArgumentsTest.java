package com.onthegomap.heapset.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ArgumentsTest {

  private static final Path CONFIG_FILE = Path.of("src", "test", "resources", "test.properties");

  @Test
  void testDefaultsWhenNothingIsSet() {
    Arguments args = Arguments.of();
    assertEquals(4, args.getInteger("arity", "arity", 4));
    assertEquals(0L, args.getLong("seed", "seed", 0));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "initial_capacity=64",
    "initial-capacity=64",
    "--initial-capacity=64",
    "--INITIAL.CAPACITY=64",
    "-initial_capacity=64",
  })
  void testKeySpellingsFromCommandLine(String arg) {
    assertEquals(64, Arguments.fromArgs(arg).getInteger("initial_capacity", "capacity", 0));
  }

  @Test
  void testValueAfterFlag() {
    Arguments args = Arguments.fromArgs("--rows", "20", "--cols", " 30 ", "seed=5");
    assertEquals(20, args.getInteger("rows", "rows", 100));
    assertEquals(30, args.getInteger("cols", "cols", 100));
    assertEquals(5L, args.getLong("seed", "seed", 0));
  }

  @Test
  void testFlagWithoutValueIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromArgs("--rows"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromArgs("--rows", "--cols", "3"));
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromArgs("rows"));
  }

  @Test
  void testInvalidNumbers() {
    Arguments args = Arguments.of("arity", "four", "seed", "1.5");
    var error = assertThrows(IllegalArgumentException.class, () -> args.getInteger("arity", "arity", 4));
    assertEquals(NumberFormatException.class, error.getCause().getClass());
    assertThrows(IllegalArgumentException.class, () -> args.getLong("seed", "seed", 0));
  }

  @Test
  void testLongBeyondIntRange() {
    long seed = Integer.MAX_VALUE * 3L;
    assertEquals(seed, Arguments.of("seed", seed).getLong("seed", "seed", 0));
  }

  @Test
  void testOfRequiresPairs() {
    assertThrows(IllegalArgumentException.class, () -> Arguments.of("arity"));
  }

  @Test
  void testOrElseChecksEarlierSourcesFirst() {
    Arguments args = Arguments.of("arity", 2, "rows", 5)
      .orElse(Arguments.of("arity", 8, "cols", 6))
      .orElse(Arguments.of("cols", 7, "seed", 9));
    assertEquals(2, args.getInteger("arity", "arity", 4));
    assertEquals(5, args.getInteger("rows", "rows", 100));
    assertEquals(6, args.getInteger("cols", "cols", 100));
    assertEquals(9L, args.getLong("seed", "seed", 0));
    assertEquals(10, args.getInteger("max_weight", "weight", 10));
  }

  @Test
  void testEnvironment() {
    Map<String, String> env = Map.of(
      "ARITY", "3",
      "HEAPSETARITY", "5",
      "HEAPSET_ARITY", "8",
      "HEAPSET_INITIAL_CAPACITY", "64"
    );
    Arguments args = Arguments.fromEnvironment(env::get);
    assertEquals(8, args.getInteger("arity", "arity", 4));
    assertEquals(64, args.getInteger("initial-capacity", "capacity", 0));
    assertEquals(100, args.getInteger("rows", "rows", 100));
  }

  @Test
  void testJvmProperties() {
    Map<String, String> properties = Map.of(
      "arity", "3",
      "HEAPSET_ARITY", "5",
      "heapset.arity", "6",
      "heapset.initial_capacity", "32"
    );
    Arguments args = Arguments.fromJvmProperties(properties::get);
    assertEquals(6, args.getInteger("arity", "arity", 4));
    assertEquals(32, args.getInteger("initial-capacity", "capacity", 0));
  }

  @Test
  void testJvmPropertiesOverrideEnvironment() {
    Map<String, String> env = Map.of("HEAPSET_ARITY", "8", "HEAPSET_ROWS", "40");
    Map<String, String> properties = Map.of("heapset.arity", "2");
    Arguments args = Arguments.fromJvmProperties(properties::get)
      .orElse(Arguments.fromEnvironment(env::get));
    assertEquals(2, args.getInteger("arity", "arity", 4));
    assertEquals(40, args.getInteger("rows", "rows", 100));
  }

  @Test
  void testConfigFile() {
    Arguments args = Arguments.fromConfigFile(CONFIG_FILE);
    assertEquals(8, args.getInteger("arity", "arity", 4));
    assertEquals(12, args.getInteger("rows", "rows", 100));
    assertEquals(3, args.getInteger("max_weight", "weight", 10));
    assertEquals(100, args.getInteger("cols", "cols", 100));
  }

  @Test
  void testMissingConfigFile() {
    Path missing = CONFIG_FILE.resolveSibling("missing.properties");
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromConfigFile(missing));
    assertThrows(IllegalArgumentException.class, () -> Arguments.fromArgsOrConfigFile("config=" + missing));
  }

  @Test
  void testConfigFileIsLastFallback() {
    Arguments args = Arguments.fromArgsOrConfigFile("--config", CONFIG_FILE.toString(), "rows=50");
    assertEquals(50, args.getInteger("rows", "rows", 100));
    assertEquals(8, args.getInteger("arity", "arity", 4));
    assertEquals(3, args.getInteger("max-weight", "weight", 10));
    assertEquals(100, args.getInteger("cols", "cols", 100));
  }
}
