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

import com.carrotsearch.hppc.ObjectIntHashMap;
import com.carrotsearch.hppc.cursors.ObjectIntCursor;
import com.onthegomap.heapset.config.HeapConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import net.jcip.annotations.NotThreadSafe;

/**
 * A {@link HeapStore} that also keeps track of the slot each element is stored in, so elements can be removed or have
 * their priority changed in {@code O(log(N))} time.
 * <p>
 * Elements are identified by {@link Object#equals(Object)} and {@link Object#hashCode()} unless another
 * {@link ElementEquivalence} is passed to the constructor. Each element can be in the heap at most once and may not be
 * {@code null}.
 * <p>
 * Ported from <a href=
 * "https://github.com/graphhopper/graphhopper/blob/master/core/src/main/java/com/graphhopper/coll/MinHeapWithUpdate.java">GraphHopper</a>
 * and modified to track arbitrary elements in a hash map instead of {@code int} ids in a fixed-size array.
 *
 * @param <E> type of the elements stored
 * @param <P> type of the priorities elements are ordered by
 */
@NotThreadSafe
public class IndexedHeap<E, P> extends HeapStore<E, P> {
  protected static final int NOT_PRESENT = -1;
  private final ElementEquivalence<? super E> equivalence;
  private final ObjectIntHashMap<E> positions;

  public IndexedHeap() {
    this(0, naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  public IndexedHeap(int initialCapacity) {
    this(initialCapacity, naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  public IndexedHeap(Comparator<? super P> comparator) {
    this(0, comparator, HeapConfig.DEFAULT_ARITY);
  }

  public IndexedHeap(int initialCapacity, Comparator<? super P> comparator, int arity) {
    this(initialCapacity, comparator, arity, ElementEquivalence.EQUALS);
  }

  /**
   * @param initialCapacity the number of elements that can be stored before the backing arrays need to grow
   * @param comparator      ordering for priorities, the lowest priority is returned first
   * @param arity           the maximum number of children each element has, at least 2
   * @param equivalence     decides when two elements are the same element
   */
  public IndexedHeap(int initialCapacity, Comparator<? super P> comparator, int arity,
    ElementEquivalence<? super E> equivalence) {
    super(initialCapacity, comparator, arity);
    this.equivalence = Objects.requireNonNull(equivalence, "equivalence");
    positions = Hppc.newObjectIntHashMap(initialCapacity, equivalence);
  }

  /**
   * Creates a heap holding all {@code values}, ordered in a single linear-time pass.
   *
   * @throws IllegalArgumentException if {@code values} contains the same element twice
   */
  public IndexedHeap(Iterable<HeapEntry<E, P>> values, Comparator<? super P> comparator, int arity) {
    this(values, comparator, arity, ElementEquivalence.EQUALS);
  }

  /**
   * Creates a heap holding all {@code values} matched by {@code equivalence}, ordered in a single linear-time pass.
   *
   * @throws IllegalArgumentException if {@code values} contains the same element twice
   */
  public IndexedHeap(Iterable<HeapEntry<E, P>> values, Comparator<? super P> comparator, int arity,
    ElementEquivalence<? super E> equivalence) {
    this(0, comparator, arity, equivalence);
    insertAll(values);
  }

  /** Returns the strategy used to decide when two elements are the same element. */
  public ElementEquivalence<? super E> equivalence() {
    return equivalence;
  }

  /**
   * Adds an element to the heap. Its illegal to insert the same element twice (unless it was removed before). To change
   * the priority of an element contained in the heap use {@link #tryUpdate} or {@link #enqueueOrUpdate}.
   *
   * @throws IllegalStateException if the heap already contains {@code element}
   */
  @Override
  public void insert(E element, P priority) {
    checkAbsent(element);
    super.insert(element, priority);
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if an element in {@code values} is already in the heap, or appears twice
   */
  @Override
  public void insertAll(Iterable<HeapEntry<E, P>> values) {
    Objects.requireNonNull(values, "values");
    // validate everything up front so a duplicate leaves the heap untouched
    List<HeapEntry<E, P>> batch = new ArrayList<>();
    ObjectIntHashMap<E> seen = Hppc.newObjectIntHashMap(0, equivalence);
    for (var entry : values) {
      E element = Objects.requireNonNull(Objects.requireNonNull(entry, "entry").element(), "element");
      if (positions.containsKey(element) || seen.containsKey(element)) {
        throw new IllegalArgumentException("Duplicate element: " + element);
      }
      seen.put(element, batch.size());
      batch.add(entry);
    }
    super.insertAll(batch);
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException if the heap already contains {@code element}
   */
  @Override
  public HeapEntry<E, P> replaceMin(E element, P priority) {
    checkAbsent(element);
    return super.replaceMin(element, priority);
  }

  /** Returns true if the heap contains {@code element}. */
  public boolean contains(E element) {
    return element != null && positions.containsKey(element);
  }

  /** Returns the priority currently stored for {@code element}, or {@code null} if it is not in the heap. */
  public P getPriority(E element) {
    int index = indexOf(element);
    return index == NOT_PRESENT ? null : priorityAt(index);
  }

  /**
   * Removes {@code element} from the heap.
   *
   * @return {@code false} if the heap did not contain {@code element}
   */
  public boolean tryRemove(E element) {
    int index = indexOf(element);
    if (index == NOT_PRESENT) {
      return false;
    }
    version++;
    removeAt(index);
    return true;
  }

  /**
   * Changes the priority of {@code element}, moving it toward the root if it decreased or toward the leaves if it
   * increased. The complexity of this method is {@code O(log(N))}, just like insert/extract.
   *
   * @return {@code false} if the heap did not contain {@code element}
   */
  public boolean tryUpdate(E element, P priority) {
    int index = indexOf(element);
    if (index == NOT_PRESENT) {
      return false;
    }
    update(index, priority);
    return true;
  }

  /** Adds {@code element} to the heap if it is not there yet, otherwise changes its priority. */
  public void enqueueOrUpdate(E element, P priority) {
    int index = indexOf(Objects.requireNonNull(element, "element"));
    if (index == NOT_PRESENT) {
      super.insert(element, priority);
    } else {
      update(index, priority);
    }
  }

  @Override
  public void clear() {
    positions.clear();
    super.clear();
  }

  @Override
  public void checkInvariants() {
    super.checkInvariants();
    if (positions.size() != count) {
      throw new IllegalStateException("Index has " + positions.size() + " entries but heap has " + count + " elements");
    }
    for (ObjectIntCursor<E> cursor : positions) {
      int index = cursor.value;
      if (index < 0 || index >= count || !equivalence.equivalent(elementAt(index), cursor.key)) {
        throw new IllegalStateException("Element " + cursor.key + " maps to invalid heap location " + index +
          (index >= 0 && index < count ? " which contains " + elements[index] : ""));
      }
    }
  }

  @Override
  protected void place(int index, E element, P priority) {
    super.place(index, element, priority);
    positions.put(element, index);
  }

  @Override
  protected void removed(E element) {
    positions.remove(element);
  }

  private int indexOf(E element) {
    return element == null ? NOT_PRESENT : positions.getOrDefault(element, NOT_PRESENT);
  }

  private void update(int index, P priority) {
    int cmp = comparator.compare(priority, priorityAt(index));
    if (cmp < 0) {
      version++;
      siftUp(index, elementAt(index), priority);
    } else if (cmp > 0) {
      version++;
      siftDown(index, elementAt(index), priority);
    }
  }

  private void checkAbsent(E element) {
    Objects.requireNonNull(element, "element");
    if (positions.containsKey(element)) {
      throw new IllegalStateException("Element " + element +
        " was inserted already, you need to use tryUpdate or enqueueOrUpdate if you want to change its priority");
    }
  }
}
