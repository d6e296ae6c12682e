package io.lacuna.rbtree;

import io.lacuna.rbtree.nodes.TreeNodes;
import io.lacuna.rbtree.nodes.TreeNodes.Node;
import io.lacuna.rbtree.utils.Iterators;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Functions over a tree snapshot, as returned by {@link OrderedMap#share()}. A snapshot is immutable, so any number of
 * these may be applied to it, in any order, without affecting one another or the map it came from.
 */
public class Trees {

  private Trees() {
  }

  /**
   * @param snapshot  a tree root
   * @param direction the traversal order
   * @return a lazy, single-pass iterator over the snapshot's entries
   */
  public static <K, V> Iterator<IEntry<K, V>> iter(Node<K, V> snapshot, Direction direction) {
    return TreeNodes.iterator(snapshot, direction);
  }

  /**
   * @return the number of entries in the snapshot, which requires a full traversal
   */
  public static long size(Node<?, ?> snapshot) {
    return TreeNodes.size(snapshot);
  }

  public static boolean isEmpty(Node<?, ?> snapshot) {
    return snapshot.isLeaf();
  }

  public static <K, V> boolean equals(Node<K, V> a, Node<K, V> b) {
    return equals(a, b, Objects::equals, Objects::equals);
  }

  /**
   * Two snapshots are equal if they yield pairwise equal entries in ascending order. Their shapes may differ.
   */
  public static <K, V> boolean equals(
      Node<K, V> a,
      Node<K, V> b,
      BiPredicate<K, K> keyEquals,
      BiPredicate<V, V> valEquals
  ) {
    if (a == b) {
      return true;
    }

    return Iterators.equals(
        iter(a, Direction.FORWARD),
        iter(b, Direction.FORWARD),
        (x, y) -> x.equals(y, keyEquals, valEquals));
  }

  public static <K, V> String toString(Node<K, V> snapshot) {
    return Maps.toString(iter(snapshot, Direction.FORWARD));
  }
}
