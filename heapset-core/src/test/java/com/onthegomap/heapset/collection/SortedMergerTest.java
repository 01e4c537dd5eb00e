package com.onthegomap.heapset.collection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SortedMergerTest {
  record Item(long key, int secondary) {
    long value() {
      return key + secondary;
    }
  }

  private static final Comparator<Item> ORDER = Comparator.comparingLong(Item::key).thenComparingInt(Item::secondary);

  private static List<Item> list(boolean primaryKey, long... items) {
    return LongStream.of(items).mapToObj(i -> primaryKey ? new Item(i, 0) : new Item(0, (int) i)).toList();
  }

  @SafeVarargs
  private static List<Long> merge(List<Item>... lists) {
    List<Long> list = new ArrayList<>();
    var iter = SortedMerger.mergeIterators(Stream.of(lists)
      .map(List::iterator)
      .toList(), ORDER);
    iter.forEachRemaining(item -> list.add(item.value()));
    assertFalse(iter.hasNext());
    assertThrows(NoSuchElementException.class, iter::next);
    return list;
  }

  @Test
  void testMergeEmpty() {
    assertEquals(List.of(), merge());
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void testMerge1(boolean primaryKey) {
    assertEquals(List.of(), merge(list(primaryKey)));
    assertEquals(List.of(1L), merge(list(primaryKey, 1)));
    assertEquals(List.of(1L, 2L), merge(list(primaryKey, 1, 2)));
  }

  @ParameterizedTest
  @CsvSource(value = {
    ",,",
    "1,,1",
    "1,1,1 1",
    "1 2,,1 2",
    "1 2,2 3,1 2 2 3",
    "1,2,1 2",
    "1 2,3,1 2 3",
    "1 3,2,1 2 3",
  }, nullValues = {""})
  void testMerge2(String a, String b, String output) {
    for (boolean primaryKey : List.of(false, true)) {
      var listA = list(primaryKey, parse(a));
      var listB = list(primaryKey, parse(b));
      assertEquals(
        LongStream.of(parse(output)).boxed().toList(),
        merge(listA, listB),
        "primary=" + primaryKey
      );
      assertEquals(
        LongStream.of(parse(output)).boxed().toList(),
        merge(listB, listA),
        "primary=" + primaryKey
      );
    }
  }

  @ParameterizedTest
  @CsvSource(value = {
    ",,,",
    "1,,,1",
    "1,1,1,1 1 1",
    "1 2,,,1 2",
    "1 2,2 3,,1 2 2 3",
    "1,2,3,1 2 3",
    "1 2,3,4,1 2 3 4",
    "1 3,2,4,1 2 3 4",
  }, nullValues = {""})
  void testMerge3(String a, String b, String c, String output) {
    for (boolean primaryKey : List.of(false, true)) {
      var listA = list(primaryKey, parse(a));
      var listB = list(primaryKey, parse(b));
      var listC = list(primaryKey, parse(c));
      var expected = LongStream.of(parse(output)).boxed().toList();
      assertEquals(expected, merge(listA, listB, listC), "ABC primary=" + primaryKey);
      assertEquals(expected, merge(listA, listC, listB), "ACB primary=" + primaryKey);
      assertEquals(expected, merge(listB, listA, listC), "BAC primary=" + primaryKey);
      assertEquals(expected, merge(listB, listC, listA), "BCA primary=" + primaryKey);
      assertEquals(expected, merge(listC, listA, listB), "CAB primary=" + primaryKey);
      assertEquals(expected, merge(listC, listB, listA), "CBA primary=" + primaryKey);
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {2, 5, 17, 100})
  void testMergeManyRandomLists(int numLists) {
    Random random = new Random(numLists);
    List<List<Long>> lists = new ArrayList<>();
    List<Long> expected = new ArrayList<>();
    for (int i = 0; i < numLists; i++) {
      List<Long> list = new ArrayList<>();
      int size = random.nextInt(50);
      for (int j = 0; j < size; j++) {
        list.add((long) random.nextInt(1_000));
      }
      list.sort(Comparator.naturalOrder());
      lists.add(list);
      expected.addAll(list);
    }
    expected.sort(Comparator.naturalOrder());
    assertEquals(expected, SortedMerger.mergeLists(lists, Comparator.naturalOrder()));
  }

  @Test
  void testMergeWithReversedComparator() {
    List<List<Integer>> lists = List.of(List.of(9, 5, 1), List.of(8, 2), List.of(7, 6, 3));
    assertEquals(List.of(9, 8, 7, 6, 5, 3, 2, 1), SortedMerger.mergeLists(lists, Comparator.reverseOrder()));
  }

  private static long[] parse(String in) {
    return in == null ? new long[0] : Stream.of(in.split("\\s+"))
      .map(String::strip)
      .filter(d -> !d.isBlank())
      .mapToLong(Long::parseLong)
      .toArray();
  }
}
