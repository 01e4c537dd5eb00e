package com.onthegomap.heapset.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HeapConfigTest {

  @Test
  void testDefaults() {
    HeapConfig config = HeapConfig.defaults();
    assertEquals(4, config.arity());
    assertEquals(0, config.initialCapacity());
  }

  @Test
  void testFromArguments() {
    HeapConfig config = HeapConfig.from(Arguments.fromArgs("--arity=2", "--initial-capacity", "100"));
    assertEquals(new HeapConfig(2, 100), config);
  }

  @Test
  void testFromConfigFile() {
    HeapConfig config = HeapConfig.from(Arguments.fromConfigFile(Path.of("src", "test", "resources", "test.properties")));
    assertEquals(8, config.arity());
    assertEquals(0, config.initialCapacity());
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 0, 1})
  void testRejectsInvalidArity(int arity) {
    assertThrows(IllegalArgumentException.class, () -> new HeapConfig(arity, 0));
    Arguments args = Arguments.of("arity", arity);
    assertThrows(IllegalArgumentException.class, () -> HeapConfig.from(args));
  }

  @Test
  void testRejectsNegativeCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new HeapConfig(4, -1));
  }
}
