package io.lacuna.rbtree;

import io.lacuna.rbtree.nodes.TreeNodes.Node;
import io.lacuna.rbtree.utils.Iterators;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered set, backed by an {@link OrderedMap} whose values are all {@code true}.
 */
public class OrderedSet<V> implements Iterable<V> {

  final OrderedMap<V, Boolean> m;

  @SuppressWarnings("unchecked")
  public OrderedSet() {
    this((Comparator<V>) Comparator.naturalOrder());
  }

  public OrderedSet(Comparator<V> comparator) {
    this(comparator, TreeConfig.DEFAULT);
  }

  public OrderedSet(Comparator<V> comparator, TreeConfig config) {
    this.m = new OrderedMap<>(comparator, config);
  }

  public static <V> OrderedSet<V> from(Iterable<V> values, Comparator<V> comparator) {
    OrderedSet<V> result = new OrderedSet<>(comparator);
    values.forEach(result::add);
    return result;
  }

  public Comparator<V> comparator() {
    return m.comparator();
  }

  /**
   * @return true if the value was not already present
   */
  public boolean add(V value) {
    return m.put(value, Boolean.TRUE).isEmpty();
  }

  /**
   * @return true if the value was present
   */
  public boolean remove(V value) {
    return m.remove(value).isPresent();
  }

  public boolean contains(V value) {
    return m.contains(value);
  }

  public long size() {
    return m.size();
  }

  public boolean isEmpty() {
    return m.isEmpty();
  }

  public Node<V, Boolean> share() {
    return m.share();
  }

  public Optional<V> first() {
    return m.first().map(IEntry::key);
  }

  public Optional<V> last() {
    return m.last().map(IEntry::key);
  }

  public Iterator<V> elements() {
    return m.keys();
  }

  public Iterator<V> elementsRev() {
    return Iterators.map(m.entriesRev(), IEntry::key);
  }

  @Override
  public Iterator<V> iterator() {
    return elements();
  }

  @Override
  public int hashCode() {
    return m.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof OrderedSet) {
      return m.equals(((OrderedSet<?>) obj).m);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    Iterator<V> it = elements();
    while (it.hasNext()) {
      sb.append(Objects.toString(it.next()));
      if (it.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append("}");
    return sb.toString();
  }
}
