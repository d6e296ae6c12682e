package io.lacuna.rbtree;

import io.lacuna.rbtree.utils.Iterators;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;

/**
 * Utility functions for entries and the iterators which yield them.
 */
@SuppressWarnings("unchecked")
public class Maps {

  public static class Entry<K, V> implements IEntry<K, V> {
    private final K key;
    private final V value;

    public Entry(K key, V value) {
      this.key = key;
      this.value = value;
    }

    public K key() {
      return key;
    }

    public V value() {
      return value;
    }

    @Override
    public String toString() {
      return key + " = " + value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(key, value);
    }

    @Override
    public boolean equals(Object obj) {
      if (obj instanceof IEntry) {
        IEntry<K, V> e = (IEntry<K, V>) obj;
        return Objects.equals(key, e.key()) && Objects.equals(value, e.value());
      }
      return false;
    }
  }

  public static <K, V> String toString(Iterator<IEntry<K, V>> entries) {
    return toString(entries, Objects::toString, Objects::toString);
  }

  public static <K, V> String toString(
      Iterator<IEntry<K, V>> entries,
      Function<K, String> keyPrinter,
      Function<V, String> valPrinter
  ) {
    StringBuilder sb = new StringBuilder("{");

    while (entries.hasNext()) {
      IEntry<K, V> entry = entries.next();
      sb.append(keyPrinter.apply(entry.key()));
      sb.append(" ");
      sb.append(valPrinter.apply(entry.value()));

      if (entries.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append("}");

    return sb.toString();
  }

  public static <K, V> long hash(Iterator<IEntry<K, V>> entries) {
    return Iterators.toStream(entries)
        .mapToLong(e -> (Objects.hashCode(e.key()) * 31L) ^ Objects.hashCode(e.value()))
        .reduce(Long::sum)
        .orElse(0);
  }
}
