package io.lacuna.rbtree;

import java.util.function.BiPredicate;

public interface IEntry<K, V> {

  static <K, V> IEntry<K, V> of(K key, V value) {
    return new Maps.Entry<>(key, value);
  }

  K key();

  V value();

  default boolean equals(IEntry<K, V> o, BiPredicate<K, K> keyEquals, BiPredicate<V, V> valEquals) {
    return keyEquals.test(key(), o.key()) && valEquals.test(value(), o.value());
  }
}
