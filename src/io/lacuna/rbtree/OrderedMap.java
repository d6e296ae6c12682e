package io.lacuna.rbtree;

import io.lacuna.rbtree.nodes.TreeNodes;
import io.lacuna.rbtree.nodes.TreeNodes.Edit;
import io.lacuna.rbtree.nodes.TreeNodes.Node;
import io.lacuna.rbtree.utils.Iterators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * An ordered map backed by a persistent red-black tree. The map itself is mutable, but it only ever replaces its root:
 * a snapshot taken with {@link #share()} is unaffected by any later mutation, and may be iterated over or measured
 * with {@link Trees}.
 * <p>
 * Keys and values may not be {@code null}. Instances are not safe for concurrent mutation, but snapshots may be
 * shared freely between threads.
 */
public class OrderedMap<K, V> implements Iterable<IEntry<K, V>> {

  private static final Logger LOG = LoggerFactory.getLogger(OrderedMap.class);

  private final Comparator<K> comparator;
  private final TreeConfig config;
  private Node<K, V> root;
  private int hash = -1;

  @SuppressWarnings("unchecked")
  public OrderedMap() {
    this((Comparator<K>) Comparator.naturalOrder());
  }

  public OrderedMap(Comparator<K> comparator) {
    this(comparator, TreeConfig.DEFAULT);
  }

  public OrderedMap(Comparator<K> comparator, TreeConfig config) {
    this(TreeNodes.leaf(), comparator, config);
  }

  private OrderedMap(Node<K, V> root, Comparator<K> comparator, TreeConfig config) {
    this.root = root;
    this.comparator = Objects.requireNonNull(comparator, "comparator");
    this.config = Objects.requireNonNull(config, "config");
  }

  public static <K, V> OrderedMap<K, V> from(java.util.Map<K, V> m, Comparator<K> comparator) {
    OrderedMap<K, V> result = new OrderedMap<>(comparator);
    result.putAll(m);
    return result;
  }

  public Comparator<K> comparator() {
    return comparator;
  }

  public TreeConfig config() {
    return config;
  }

  public Optional<V> get(K key) {
    return Optional.ofNullable(get(key, null));
  }

  public V get(K key, V defaultValue) {
    Node<K, V> n = TreeNodes.find(root, Objects.requireNonNull(key, "key"), comparator);
    return n == null ? defaultValue : n.v;
  }

  public boolean contains(K key) {
    return TreeNodes.find(root, Objects.requireNonNull(key, "key"), comparator) != null;
  }

  /**
   * @return the value previously associated with {@code key}, if any
   */
  public Optional<V> put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");

    Edit<K, V> edit = TreeNodes.put(root, key, value, comparator);
    update(edit.root, "put", key);
    return Optional.ofNullable(edit.previous);
  }

  /**
   * Identical to {@link #put(Object, Object)}.
   */
  public Optional<V> replace(K key, V value) {
    return put(key, value);
  }

  public void putAll(java.util.Map<K, V> m) {
    m.forEach(this::put);
  }

  /**
   * @return the value which was removed, if {@code key} was present
   */
  public Optional<V> remove(K key) {
    Edit<K, V> edit = TreeNodes.remove(root, Objects.requireNonNull(key, "key"), comparator);
    if (edit.root != root) {
      update(edit.root, "remove", key);
    }
    return Optional.ofNullable(edit.previous);
  }

  public void delete(K key) {
    remove(key);
  }

  public void clear() {
    update(TreeNodes.leaf(), "clear", null);
  }

  /**
   * @return the current root, which will never change
   */
  public Node<K, V> share() {
    return root;
  }

  /**
   * Replaces the contents of this map with a snapshot, which must be ordered by the same comparator.
   */
  public void unshare(Node<K, V> snapshot) {
    update(Objects.requireNonNull(snapshot, "snapshot"), "unshare", null);
  }

  public Iterator<IEntry<K, V>> entries() {
    return Trees.iter(root, Direction.FORWARD);
  }

  public Iterator<IEntry<K, V>> entriesRev() {
    return Trees.iter(root, Direction.BACKWARD);
  }

  public Iterator<K> keys() {
    return Iterators.map(entries(), IEntry::key);
  }

  public Iterator<V> values() {
    return Iterators.map(entries(), IEntry::value);
  }

  public Stream<IEntry<K, V>> stream() {
    return Iterators.toStream(entries());
  }

  @Override
  public Iterator<IEntry<K, V>> iterator() {
    return entries();
  }

  public Optional<IEntry<K, V>> first() {
    return Optional.ofNullable(TreeNodes.min(root)).map(Node::entry);
  }

  public Optional<IEntry<K, V>> last() {
    return Optional.ofNullable(TreeNodes.max(root)).map(Node::entry);
  }

  /**
   * Folds over the entries in ascending order.
   */
  public <U> U foldLeft(U initial, BiFunction<U, IEntry<K, V>, U> f) {
    return fold(entries(), initial, f);
  }

  /**
   * Folds over the entries in descending order.
   */
  public <U> U foldRight(U initial, BiFunction<U, IEntry<K, V>, U> f) {
    return fold(entriesRev(), initial, f);
  }

  /**
   * @return a new map with the same keys, whose tree has the same shape as this one
   */
  public <U> OrderedMap<K, U> mapValues(BiFunction<K, V, U> f) {
    OrderedMap<K, U> result = new OrderedMap<>(TreeNodes.mapValues(root, (k, v) ->
        Objects.requireNonNull(f.apply(k, v), "value")), comparator, config);
    result.validate("mapValues", null);
    return result;
  }

  /**
   * Walks the whole tree.
   */
  public long size() {
    return Trees.size(root);
  }

  public boolean isEmpty() {
    return root.isLeaf();
  }

  private void update(Node<K, V> rootPrime, String operation, K key) {
    root = rootPrime;
    hash = -1;
    validate(operation, key);
  }

  private void validate(String operation, K key) {
    if (config.checkInvariants) {
      try {
        TreeNodes.checkInvariant(root, comparator);
      } catch (IllegalStateException e) {
        LOG.error("invalid tree after {}({})", operation, key);
        throw e;
      }
    }
  }

  private static <K, V, U> U fold(Iterator<IEntry<K, V>> it, U initial, BiFunction<U, IEntry<K, V>, U> f) {
    U acc = initial;
    while (it.hasNext()) {
      acc = f.apply(acc, it.next());
    }
    return acc;
  }

  @Override
  public int hashCode() {
    if (hash == -1) {
      hash = (int) Maps.hash(entries());
    }
    return hash;
  }

  @Override
  @SuppressWarnings("unchecked")
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof OrderedMap) {
      return Trees.equals(root, ((OrderedMap<K, V>) obj).root);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return Maps.toString(entries());
  }
}
