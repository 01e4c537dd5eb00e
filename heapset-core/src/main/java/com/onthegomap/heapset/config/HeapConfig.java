package com.onthegomap.heapset.config;

/**
 * Holder for the parameters that control how a heap lays out its backing arrays.
 *
 * @param arity           the maximum number of children of each element, 2 for a binary heap
 * @param initialCapacity the number of elements the heap can hold before it needs to grow
 */
public record HeapConfig(
  int arity,
  int initialCapacity
) {

  public static final int DEFAULT_ARITY = 4;
  public static final int MIN_ARITY = 2;

  public HeapConfig {
    if (arity < MIN_ARITY) {
      throw new IllegalArgumentException("Arity must be >= " + MIN_ARITY + ", was " + arity);
    }
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Initial capacity must be >= 0, was " + initialCapacity);
    }
  }

  public static HeapConfig defaults() {
    return from(Arguments.of());
  }

  public static HeapConfig from(Arguments arguments) {
    return new HeapConfig(
      arguments.getInteger("arity", "number of children of each heap element", DEFAULT_ARITY),
      arguments.getInteger("initial_capacity", "number of elements to allocate space for up front", 0)
    );
  }
}
