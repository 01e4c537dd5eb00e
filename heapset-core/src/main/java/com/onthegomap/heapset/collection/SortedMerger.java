package com.onthegomap.heapset.collection;

import com.onthegomap.heapset.config.HeapConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A utility for merging sorted lists of items into a single sorted iterator.
 */
public class SortedMerger {

  private SortedMerger() {}

  /**
   * Merges iterators that each return items sorted by {@code comparator} into a combined iterator over all the items.
   * <p>
   * Items that compare equal are returned in an arbitrary order.
   */
  public static <T> Iterator<T> mergeIterators(List<? extends Iterator<T>> iterators,
    Comparator<? super T> comparator) {
    return switch (iterators.size()) {
      case 0 -> Collections.emptyIterator();
      case 1 -> iterators.get(0);
      default -> new KWayMerge<>(iterators, comparator, HeapConfig.DEFAULT_ARITY);
    };
  }

  /** Merges sorted {@code lists} into a new sorted list. */
  public static <T> List<T> mergeLists(List<? extends List<T>> lists, Comparator<? super T> comparator) {
    List<Iterator<T>> iterators = new ArrayList<>(lists.size());
    int size = 0;
    for (var list : lists) {
      iterators.add(list.iterator());
      size += list.size();
    }
    List<T> result = new ArrayList<>(size);
    mergeIterators(iterators, comparator).forEachRemaining(result::add);
    return result;
  }

  /**
   * Keeps the head of each input in a heap keyed by the input's index, and holds the overall minimum outside of the
   * heap so advancing an input only takes a single pass down the heap.
   */
  private static class KWayMerge<T> implements Iterator<T> {

    private final List<? extends Iterator<T>> inputs;
    private final HeapStore<Integer, T> heads;
    private HeapEntry<Integer, T> next;

    KWayMerge(List<? extends Iterator<T>> inputs, Comparator<? super T> comparator, int arity) {
      this.inputs = inputs;
      this.heads = new HeapStore<>(inputs.size(), comparator, arity);
      List<HeapEntry<Integer, T>> initial = new ArrayList<>(inputs.size());
      for (int i = 0; i < inputs.size(); i++) {
        var input = inputs.get(i);
        if (input.hasNext()) {
          initial.add(new HeapEntry<>(i, input.next()));
        }
      }
      heads.insertAll(initial);
      next = heads.tryExtractMin();
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public T next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      T result = next.priority();
      int index = next.element();
      var input = inputs.get(index);
      next = input.hasNext() ? heads.replaceMin(index, input.next()) : heads.tryExtractMin();
      return result;
    }
  }
}
