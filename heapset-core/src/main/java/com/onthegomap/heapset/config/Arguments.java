package com.onthegomap.heapset.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric settings for heapset programs, looked up in an ordered chain of sources until one of them has a value.
 * <p>
 * Keys ignore case and treat {@code -}, {@code .} and {@code _} as the same character, so {@code --initial-capacity=64}
 * on the command line, {@code -Dheapset.initial_capacity=64} and {@code HEAPSET_INITIAL_CAPACITY=64} all set
 * {@code initial_capacity}.
 */
public final class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PROPERTY_PREFIX = "heapset.";
  private static final String ENV_PREFIX = "HEAPSET_";
  private static final String CONFIG_FILE_KEY = "config";

  /** Each source maps a canonical key to its raw value, or {@code null} when it does not define the key. */
  private final List<UnaryOperator<String>> sources;

  private Arguments(List<UnaryOperator<String>> sources) {
    this.sources = List.copyOf(sources);
  }

  private static Arguments fromMap(Map<String, String> values) {
    Map<String, String> canonical = new HashMap<>();
    values.forEach((key, value) -> canonical.put(canonicalKey(key), value));
    return new Arguments(List.of(canonical::get));
  }

  /** Returns arguments from alternating keys and values, for example {@code Arguments.of("arity", 8, "rows", 10)}. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected alternating keys and values, got " + keysAndValues.length + " items");
    }
    Map<String, String> values = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      values.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return fromMap(values);
  }

  /**
   * Parses command-line arguments in the forms {@code key=value}, {@code --key=value} and {@code --key value}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> values = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      String name = arg.replaceFirst("^-+", "");
      int equals = name.indexOf('=');
      if (equals >= 0) {
        values.put(name.substring(0, equals), name.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        values.put(name, args[i++].strip());
      } else {
        throw new IllegalArgumentException("Missing value for argument: " + arg);
      }
    }
    return fromMap(values);
  }

  /** Returns arguments read from JVM system properties like {@code -Dheapset.arity=8}. */
  static Arguments fromJvmProperties(UnaryOperator<String> properties) {
    return new Arguments(List.of(key -> properties.apply(JVM_PROPERTY_PREFIX + key)));
  }

  /** Returns arguments read from environmental variables like {@code HEAPSET_ARITY=8}. */
  static Arguments fromEnvironment(UnaryOperator<String> environment) {
    return new Arguments(List.of(key -> environment.apply(ENV_PREFIX + key.toUpperCase(Locale.ROOT))));
  }

  /**
   * Returns arguments read from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> values = new HashMap<>();
    properties.stringPropertyNames().forEach(name -> values.put(name, properties.getProperty(name)));
    return fromMap(values);
  }

  /**
   * Returns arguments for a program's {@code main} method.
   * <p>
   * Command-line arguments win over JVM properties, which win over environmental variables. If any of those sets
   * {@code config}, the properties file it points to is used as the last fallback.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromArgs(args)
      .orElse(fromJvmProperties(System::getProperty))
      .orElse(fromEnvironment(System::getenv));
    String configFile = arguments.lookup(CONFIG_FILE_KEY);
    if (configFile == null) {
      return arguments;
    }
    LOGGER.debug("Reading fallback arguments from {}", configFile);
    return arguments.orElse(fromConfigFile(Path.of(configFile)));
  }

  static String canonicalKey(String key) {
    return key.strip().toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
  }

  /** Returns arguments that check this instance first, then {@code fallback} for keys this one does not define. */
  public Arguments orElse(Arguments fallback) {
    List<UnaryOperator<String>> chained = new ArrayList<>(sources);
    chained.addAll(fallback.sources);
    return new Arguments(chained);
  }

  private String lookup(String key) {
    String canonical = canonicalKey(key);
    for (var source : sources) {
      String value = source.apply(canonical);
      if (value != null) {
        return value.strip();
      }
    }
    return null;
  }

  /**
   * Returns the value of {@code key} as an int, or {@code defaultValue} if no source defines it.
   *
   * @throws IllegalArgumentException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    String value = lookup(key);
    int result;
    try {
      result = value == null ? defaultValue : Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected an integer for " + key + " (" + description + "), got: " + value, e);
    }
    LOGGER.debug("argument: {}={} ({})", key, result, description);
    return result;
  }

  /**
   * Returns the value of {@code key} as a long, or {@code defaultValue} if no source defines it.
   *
   * @throws IllegalArgumentException if the value is not an integer
   */
  public long getLong(String key, String description, long defaultValue) {
    String value = lookup(key);
    long result;
    try {
      result = value == null ? defaultValue : Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected an integer for " + key + " (" + description + "), got: " + value, e);
    }
    LOGGER.debug("argument: {}={} ({})", key, result, description);
    return result;
  }
}
