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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import net.jcip.annotations.NotThreadSafe;

/**
 * A min-heap stored in parallel element and priority arrays where each element has {@code arity} children.
 * <p>
 * With the default arity of 4 this is slightly faster than a traditional binary min-heap due to a shallower, more
 * cache-friendly memory layout. The arrays start at a capacity of 4 and double each time they fill up, they only
 * shrink when {@link #trimExcess()} is called.
 * <p>
 * Ported from <a href=
 * "https://github.com/graphhopper/graphhopper/blob/master/core/src/main/java/com/graphhopper/coll/MinHeapWithUpdate.java">GraphHopper</a>
 * and:
 * <ul>
 * <li>modified to store arbitrary elements and priorities ordered by a {@link Comparator}</li>
 * <li>modified so that each element has a configurable number of children instead of 2</li>
 * <li>modified to grow the backing arrays instead of using a fixed capacity</li>
 * <li>added linear-time bulk loading and a combined insert-and-extract operation</li>
 * </ul>
 * Subclasses that need to know where each element lives can override {@link #place(int, Object, Object)} and
 * {@link #removed(Object)}.
 *
 * @param <E> type of the elements stored
 * @param <P> type of the priorities elements are ordered by
 * @see <a href="https://en.wikipedia.org/wiki/D-ary_heap">d-ary heap (wikipedia)</a>
 */
@NotThreadSafe
public class HeapStore<E, P> implements MinHeap<E, P> {
  static final int DEFAULT_CAPACITY = 4;
  private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
  private static final double TRIM_THRESHOLD = 0.9;
  private static final Object[] EMPTY = new Object[0];

  protected final int arity;
  protected final Comparator<? super P> comparator;
  protected Object[] elements;
  protected Object[] priorities;
  protected int count;
  /** Incremented on every modification so that iterators can detect concurrent changes. */
  protected int version;

  public HeapStore() {
    this(0, naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  public HeapStore(int initialCapacity) {
    this(initialCapacity, naturalOrder(), HeapConfig.DEFAULT_ARITY);
  }

  public HeapStore(Comparator<? super P> comparator) {
    this(0, comparator, HeapConfig.DEFAULT_ARITY);
  }

  /**
   * @param initialCapacity the number of elements that can be stored before the backing arrays need to grow
   * @param comparator      ordering for priorities, the lowest priority is returned first
   * @param arity           the maximum number of children each element has, at least 2
   */
  public HeapStore(int initialCapacity, Comparator<? super P> comparator, int arity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Initial capacity must be >= 0, was " + initialCapacity);
    }
    if (arity < 2) {
      throw new IllegalArgumentException("Arity must be >= 2, was " + arity);
    }
    this.comparator = Objects.requireNonNull(comparator, "comparator");
    this.arity = arity;
    elements = initialCapacity == 0 ? EMPTY : new Object[initialCapacity];
    priorities = initialCapacity == 0 ? EMPTY : new Object[initialCapacity];
  }

  /** Creates a heap holding all {@code values}, ordered in a single linear-time pass. */
  public HeapStore(Iterable<HeapEntry<E, P>> values, Comparator<? super P> comparator, int arity) {
    this(0, comparator, arity);
    insertAll(values);
  }

  @SuppressWarnings("unchecked")
  static <P> Comparator<P> naturalOrder() {
    return (a, b) -> ((Comparable<? super P>) a).compareTo(b);
  }

  @Override
  public int size() {
    return count;
  }

  @Override
  public boolean isEmpty() {
    return count == 0;
  }

  @Override
  public int capacity() {
    return elements.length;
  }

  @Override
  public int arity() {
    return arity;
  }

  @Override
  public Comparator<? super P> comparator() {
    return comparator;
  }

  @Override
  public void insert(E element, P priority) {
    version++;
    append(element, priority);
  }

  @Override
  public void insertAll(Iterable<HeapEntry<E, P>> values) {
    Objects.requireNonNull(values, "values");
    // the heap is not written to until the whole batch has been read
    List<HeapEntry<E, P>> batch = new ArrayList<>();
    for (var entry : values) {
      batch.add(Objects.requireNonNull(entry, "entry"));
    }
    if (batch.isEmpty()) {
      return;
    }
    version++;
    if (count == 0) {
      while (elements.length < batch.size()) {
        grow();
      }
      for (var entry : batch) {
        place(count, entry.element(), entry.priority());
        count++;
      }
      heapify();
    } else {
      for (var entry : batch) {
        append(entry.element(), entry.priority());
      }
    }
  }

  @Override
  public HeapEntry<E, P> peekMin() {
    checkNotEmpty();
    return entryAt(0);
  }

  @Override
  public HeapEntry<E, P> tryPeekMin() {
    return count == 0 ? null : entryAt(0);
  }

  @Override
  public E peekElement() {
    checkNotEmpty();
    return elementAt(0);
  }

  @Override
  public P peekPriority() {
    checkNotEmpty();
    return priorityAt(0);
  }

  @Override
  public HeapEntry<E, P> extractMin() {
    checkNotEmpty();
    version++;
    return removeAt(0);
  }

  @Override
  public HeapEntry<E, P> tryExtractMin() {
    if (count == 0) {
      return null;
    }
    version++;
    return removeAt(0);
  }

  @Override
  public HeapEntry<E, P> replaceMin(E element, P priority) {
    if (count == 0 || comparator.compare(priority, priorityAt(0)) <= 0) {
      return new HeapEntry<>(element, priority);
    }
    version++;
    HeapEntry<E, P> min = entryAt(0);
    removed(min.element());
    siftDown(0, element, priority);
    return min;
  }

  @Override
  public void clear() {
    version++;
    if (count > 0) {
      Arrays.fill(elements, 0, count, null);
      Arrays.fill(priorities, 0, count, null);
      count = 0;
    }
  }

  @Override
  public void trimExcess() {
    int threshold = (int) (elements.length * TRIM_THRESHOLD);
    if (count < threshold) {
      version++;
      resize(count);
    }
  }

  @Override
  public List<E> unorderedElements() {
    List<E> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      result.add(elementAt(i));
    }
    return result;
  }

  /**
   * Returns an iterator over the entries in this heap in the order they are stored in the backing array.
   *
   * @throws ConcurrentModificationException from {@link Iterator#hasNext()} or {@link Iterator#next()} if the heap was
   *                                         modified after the iterator was created
   */
  @Override
  public Iterator<HeapEntry<E, P>> iterator() {
    return new Iterator<>() {
      private final int expectedVersion = version;
      private int index = 0;

      private void checkVersion() {
        if (version != expectedVersion) {
          throw new ConcurrentModificationException("Heap was modified during iteration");
        }
      }

      @Override
      public boolean hasNext() {
        checkVersion();
        return index < count;
      }

      @Override
      public HeapEntry<E, P> next() {
        checkVersion();
        if (index >= count) {
          throw new NoSuchElementException();
        }
        return entryAt(index++);
      }
    };
  }

  @Override
  public void checkInvariants() {
    if (elements.length != priorities.length) {
      throw new IllegalStateException(
        "Element array length " + elements.length + " does not match priority array length " + priorities.length);
    }
    if (count < 0 || count > elements.length) {
      throw new IllegalStateException("Invalid size " + count + " for capacity " + elements.length);
    }
    for (int i = 1; i < count; i++) {
      int parent = parent(i);
      if (comparator.compare(priorityAt(parent), priorityAt(i)) > 0) {
        throw new IllegalStateException("Heap order violated: priority " + priorityAt(parent) + " at " + parent +
          " is greater than priority " + priorityAt(i) + " of its child at " + i);
      }
    }
    for (int i = count; i < elements.length; i++) {
      if (elements[i] != null || priorities[i] != null) {
        throw new IllegalStateException("Unused slot " + i + " was not cleared");
      }
    }
  }

  @SuppressWarnings("unchecked")
  protected final E elementAt(int index) {
    return (E) elements[index];
  }

  @SuppressWarnings("unchecked")
  protected final P priorityAt(int index) {
    return (P) priorities[index];
  }

  protected final HeapEntry<E, P> entryAt(int index) {
    return new HeapEntry<>(elementAt(index), priorityAt(index));
  }

  protected final int parent(int index) {
    return (index - 1) / arity;
  }

  /** Stores {@code element} at {@code index}, all writes to valid slots of the backing arrays go through here. */
  protected void place(int index, E element, P priority) {
    elements[index] = element;
    priorities[index] = priority;
  }

  /** Called after {@code element} has been removed from the heap. */
  protected void removed(E element) {}

  /**
   * Removes the element at {@code index} by moving the last element into its slot and restoring heap order around it.
   */
  protected HeapEntry<E, P> removeAt(int index) {
    assert index >= 0 && index < count;
    HeapEntry<E, P> result = entryAt(index);
    int last = --count;
    E lastElement = elementAt(last);
    P lastPriority = priorityAt(last);
    elements[last] = null;
    priorities[last] = null;
    if (index < last) {
      // the last element may need to move toward the root or the leaves from an interior slot
      if (index > 0 && comparator.compare(lastPriority, priorityAt(parent(index))) < 0) {
        siftUp(index, lastElement, lastPriority);
      } else {
        siftDown(index, lastElement, lastPriority);
      }
    }
    removed(result.element());
    return result;
  }

  private void append(E element, P priority) {
    if (count == elements.length) {
      grow();
    }
    siftUp(count++, element, priority);
  }

  /** Moves the held-out {@code element} from {@code index} toward the root until its parent is not greater. */
  protected final void siftUp(int index, E element, P priority) {
    while (index > 0) {
      int parent = parent(index);
      P parentPriority = priorityAt(parent);
      if (comparator.compare(parentPriority, priority) <= 0) {
        break;
      }
      place(index, elementAt(parent), parentPriority);
      index = parent;
    }
    place(index, element, priority);
  }

  /**
   * Moves the held-out {@code element} from {@code index} toward the leaves until none of its children are smaller.
   * <p>
   * When several children share the lowest priority, the one with the lowest index is chosen.
   */
  protected final void siftDown(int index, E element, P priority) {
    final int size = count;
    long child;
    while ((child = (long) arity * index + 1) < size) {
      int minChild = (int) child;
      P minPriority = priorityAt(minChild);
      int end = (int) Math.min(size, child + arity);
      for (int next = minChild + 1; next < end; next++) {
        P nextPriority = priorityAt(next);
        if (comparator.compare(nextPriority, minPriority) < 0) {
          minChild = next;
          minPriority = nextPriority;
        }
      }
      if (comparator.compare(priority, minPriority) <= 0) {
        break;
      }
      place(index, elementAt(minChild), minPriority);
      index = minChild;
    }
    place(index, element, priority);
  }

  private void heapify() {
    if (count <= 1) {
      return;
    }
    // leaves are already valid heaps, so start from the parent of the last element
    for (int i = parent(count - 1); i >= 0; i--) {
      siftDown(i, elementAt(i), priorityAt(i));
    }
  }

  private void grow() {
    int capacity = elements.length;
    if (capacity >= MAX_CAPACITY) {
      throw new OutOfMemoryError("Cannot grow heap beyond " + MAX_CAPACITY + " elements");
    }
    int newCapacity = capacity == 0 ? DEFAULT_CAPACITY : (int) Math.min(MAX_CAPACITY, 2L * capacity);
    resize(newCapacity);
  }

  private void resize(int newCapacity) {
    elements = newCapacity == 0 ? EMPTY : Arrays.copyOf(elements, newCapacity);
    priorities = newCapacity == 0 ? EMPTY : Arrays.copyOf(priorities, newCapacity);
  }

  private void checkNotEmpty() {
    if (count == 0) {
      throw new NoSuchElementException("Heap is empty");
    }
  }
}
