package com.onthegomap.heapset.collection;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/**
 * Decides when two elements of an {@link IndexedHeap} are the same element.
 * <p>
 * Implementations must be consistent: elements that are equivalent must have the same hash.
 *
 * @param <E> type of the elements compared
 */
public interface ElementEquivalence<E> {

  /** Matches elements by {@link Object#equals(Object)} and {@link Object#hashCode()}. */
  ElementEquivalence<Object> EQUALS = of(Objects::equals, Objects::hashCode);

  /** Matches elements by reference, two elements are the same only if they are the same instance. */
  ElementEquivalence<Object> IDENTITY = of((a, b) -> a == b, System::identityHashCode);

  boolean equivalent(E a, E b);

  int hash(E element);

  /** Returns an equivalence built from an {@code equivalent} predicate and a matching {@code hash} function. */
  static <E> ElementEquivalence<E> of(BiPredicate<? super E, ? super E> equivalent, ToIntFunction<? super E> hash) {
    Objects.requireNonNull(equivalent, "equivalent");
    Objects.requireNonNull(hash, "hash");
    return new ElementEquivalence<>() {
      @Override
      public boolean equivalent(E a, E b) {
        return equivalent.test(a, b);
      }

      @Override
      public int hash(E element) {
        return hash.applyAsInt(element);
      }
    };
  }
}
