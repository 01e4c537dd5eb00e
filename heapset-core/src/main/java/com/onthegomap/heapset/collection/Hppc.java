package com.onthegomap.heapset.collection;

import com.carrotsearch.hppc.BitMixer;
import com.carrotsearch.hppc.ObjectIntHashMap;

/**
 * Static factory method for <a href="https://github.com/carrotsearch/hppc">High Performance Primitive Collections</a>.
 */
public class Hppc {

  private Hppc() {}

  public static <T> ObjectIntHashMap<T> newObjectIntHashMap(int size) {
    return new ObjectIntHashMap<>(size, 0.75);
  }

  /** Returns a map that matches keys using {@code equivalence} instead of their own equals and hashCode methods. */
  public static <T> ObjectIntHashMap<T> newObjectIntHashMap(int size, ElementEquivalence<? super T> equivalence) {
    if (equivalence == ElementEquivalence.EQUALS) {
      return newObjectIntHashMap(size);
    }
    return new ObjectIntHashMap<T>(size, 0.75) {
      @Override
      protected int hashKey(T key) {
        return BitMixer.mixPhi(equivalence.hash(key));
      }

      @Override
      @SuppressWarnings("unchecked")
      protected boolean equals(Object v1, Object v2) {
        return v1 == v2 || (v1 != null && v2 != null && equivalence.equivalent((T) v1, (T) v2));
      }
    };
  }
}
