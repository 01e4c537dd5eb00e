/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.onthegomap.heapset.collection;

import com.onthegomap.heapset.config.HeapConfig;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * API for min-heaps that store elements ordered by a priority, where the element with the lowest priority is always
 * returned first.
 * <p>
 * Elements with equal priorities are returned in an arbitrary order. Iterating over a heap returns entries in the order
 * they are stored in the backing array, not in priority order, only repeated calls to {@link #extractMin()} return
 * elements sorted by priority.
 * <p>
 * Ported from <a href=
 * "https://github.com/graphhopper/graphhopper/blob/master/core/src/main/java/com/graphhopper/coll/MinHeapWithUpdate.java">GraphHopper</a>
 * and modified to store arbitrary elements and priorities, and to extract a common interface for subclass
 * implementations.
 *
 * @param <E> type of the elements stored
 * @param <P> type of the priorities elements are ordered by
 */
public interface MinHeap<E, P> extends Iterable<HeapEntry<E, P>> {

  /**
   * Returns a new empty min-heap where each element has 4 children backed by an array that grows as needed and orders
   * priorities by their natural order.
   */
  static <E, P extends Comparable<? super P>> HeapStore<E, P> newHeap() {
    return new HeapStore<>();
  }

  /** Returns a new empty min-heap with the arity and initial capacity from {@code config}. */
  static <E, P> HeapStore<E, P> newHeap(HeapConfig config, Comparator<? super P> comparator) {
    return new HeapStore<>(config.initialCapacity(), comparator, config.arity());
  }

  /** Returns a new min-heap populated from {@code values} in linear time. */
  static <E, P extends Comparable<? super P>> HeapStore<E, P> newHeap(Iterable<HeapEntry<E, P>> values) {
    return new HeapStore<>(values, Comparator.naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  /**
   * Returns a new empty min-heap that also tracks the position of each element so that it can be removed or have its
   * priority changed in {@code O(log(N))} time.
   */
  static <E, P extends Comparable<? super P>> IndexedHeap<E, P> newIndexedHeap() {
    return new IndexedHeap<>();
  }

  /** Returns a new empty indexed min-heap with the arity and initial capacity from {@code config}. */
  static <E, P> IndexedHeap<E, P> newIndexedHeap(HeapConfig config, Comparator<? super P> comparator) {
    return new IndexedHeap<>(config.initialCapacity(), comparator, config.arity());
  }

  /**
   * Returns a new empty indexed min-heap with the arity and initial capacity from {@code config} that matches elements
   * using {@code equivalence}, for example {@link ElementEquivalence#IDENTITY}.
   */
  static <E, P> IndexedHeap<E, P> newIndexedHeap(HeapConfig config, Comparator<? super P> comparator,
    ElementEquivalence<? super E> equivalence) {
    return new IndexedHeap<>(config.initialCapacity(), comparator, config.arity(), equivalence);
  }

  /**
   * Returns a new indexed min-heap populated from {@code values} in linear time.
   *
   * @throws IllegalArgumentException if {@code values} contains the same element twice
   */
  static <E, P extends Comparable<? super P>> IndexedHeap<E, P> newIndexedHeap(Iterable<HeapEntry<E, P>> values) {
    return new IndexedHeap<>(values, Comparator.naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  int size();

  boolean isEmpty();

  /** Returns the number of elements the heap can hold before it needs to grow its backing arrays. */
  int capacity();

  /** Returns the maximum number of children each element in the heap has. */
  int arity();

  Comparator<? super P> comparator();

  /** Adds an element to the heap, growing the backing arrays if they are full. */
  void insert(E element, P priority);

  /**
   * Adds all {@code values} to the heap.
   * <p>
   * When the heap is empty the values are appended unsorted and then ordered in a single {@code O(N)} pass, otherwise
   * each value is inserted individually.
   */
  void insertAll(Iterable<HeapEntry<E, P>> values);

  /**
   * Returns the element with the lowest priority without removing it.
   *
   * @throws NoSuchElementException if the heap is empty
   */
  HeapEntry<E, P> peekMin();

  /** Returns the element with the lowest priority without removing it, or {@code null} if the heap is empty. */
  HeapEntry<E, P> tryPeekMin();

  /**
   * @throws NoSuchElementException if the heap is empty
   */
  E peekElement();

  /**
   * @throws NoSuchElementException if the heap is empty
   */
  P peekPriority();

  /**
   * Removes and returns the element with the lowest priority.
   *
   * @throws NoSuchElementException if the heap is empty
   */
  HeapEntry<E, P> extractMin();

  /** Removes and returns the element with the lowest priority, or {@code null} if the heap is empty. */
  HeapEntry<E, P> tryExtractMin();

  /**
   * Adds an element to the heap then removes and returns the element with the lowest priority, using a single pass
   * down the heap.
   * <p>
   * If the heap is empty or {@code priority} is less than or equal to the lowest priority in the heap then the new
   * element is returned and the heap is not modified.
   */
  HeapEntry<E, P> replaceMin(E element, P priority);

  /** Removes all elements from the heap, but keeps the backing arrays at their current capacity. */
  void clear();

  /** Shrinks the backing arrays down to the current size if less than 90% of their capacity is used. */
  void trimExcess();

  /** Returns a copy of the elements in the heap in the order they are stored in the backing array. */
  List<E> unorderedElements();

  /**
   * Verifies that the internal state of this heap is consistent.
   *
   * @throws IllegalStateException describing the first inconsistency found
   */
  void checkInvariants();
}
