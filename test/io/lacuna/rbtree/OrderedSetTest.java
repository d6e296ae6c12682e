package io.lacuna.rbtree;

import io.lacuna.rbtree.nodes.TreeNodes.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class OrderedSetTest {

  static <V> List<V> elements(OrderedSet<V> s) {
    List<V> result = new ArrayList<>();
    s.forEach(result::add);
    return result;
  }

  @Test
  void addAndRemove() {
    OrderedSet<String> s = new OrderedSet<>();
    assertTrue(s.add("b"));
    assertTrue(s.add("a"));
    assertFalse(s.add("b"));
    assertEquals(2, s.size());
    assertEquals(List.of("a", "b"), elements(s));

    assertTrue(s.remove("a"));
    assertFalse(s.remove("a"));
    assertFalse(s.contains("a"));
    assertTrue(s.contains("b"));
  }

  @Test
  void orderedByComparator() {
    OrderedSet<Integer> s = OrderedSet.from(List.of(5, 1, 4, 2, 3, 1), Comparator.reverseOrder());
    assertEquals(List.of(5, 4, 3, 2, 1), elements(s));

    List<Integer> rev = new ArrayList<>();
    s.elementsRev().forEachRemaining(rev::add);
    assertEquals(List.of(1, 2, 3, 4, 5), rev);

    assertEquals(Optional.of(5), s.first());
    assertEquals(Optional.of(1), s.last());
    assertEquals("{5, 4, 3, 2, 1}", s.toString());
  }

  @Test
  void snapshots() {
    OrderedSet<Integer> s = OrderedSet.from(List.of(1, 2, 3), Integer::compare);
    Node<Integer, Boolean> snapshot = s.share();
    s.add(4);
    s.remove(1);

    assertEquals(3, Trees.size(snapshot));
    assertEquals(List.of(2, 3, 4), elements(s));
  }

  @Test
  void randomChurn() {
    Random rand = new Random(99);
    TreeSet<Integer> expected = new TreeSet<>();
    OrderedSet<Integer> s = new OrderedSet<>(Integer::compare, TreeConfig.builder().checkInvariants(true).build());

    for (int i = 0; i < 3000; i++) {
      int v = rand.nextInt(100);
      if (rand.nextBoolean()) {
        assertEquals(expected.add(v), s.add(v));
      } else {
        assertEquals(expected.remove(v), s.remove(v));
      }
    }

    assertEquals(new ArrayList<>(expected), elements(s));
    assertEquals(expected.isEmpty(), s.isEmpty());
  }

  @Test
  void equality() {
    OrderedSet<Integer> a = OrderedSet.from(List.of(1, 2, 3), Integer::compare);
    OrderedSet<Integer> b = OrderedSet.from(List.of(3, 2, 1), Integer::compare);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    b.remove(2);
    assertNotEquals(a, b);
  }
}
