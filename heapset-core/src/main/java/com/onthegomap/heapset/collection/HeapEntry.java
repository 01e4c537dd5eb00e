package com.onthegomap.heapset.collection;

/**
 * An element stored in a {@link MinHeap} along with the priority it is ordered by.
 *
 * @param element  the value stored in the heap
 * @param priority the value the heap orders elements by, lowest first
 * @param <E>      type of the element
 * @param <P>      type of the priority
 */
public record HeapEntry<E, P>(E element, P priority) {

  /** Shorthand for {@code new HeapEntry<>(element, priority)}. */
  public static <E, P> HeapEntry<E, P> of(E element, P priority) {
    return new HeapEntry<>(element, priority);
  }
}
