package io.lacuna.rbtree.utils;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public class Iterators {

  public static final Iterator EMPTY = new Iterator() {
    @Override
    public boolean hasNext() {
      return false;
    }

    @Override
    public Object next() {
      throw new NoSuchElementException();
    }
  };

  /**
   * @return true if both iterators yield the same number of values, and each pair satisfies {@code equals}
   */
  public static <V> boolean equals(Iterator<V> a, Iterator<V> b, BiPredicate<V, V> equals) {
    while (a.hasNext()) {
      if (!b.hasNext() || !equals.test(a.next(), b.next())) {
        return false;
      }
    }
    return !b.hasNext();
  }

  public static <V> Iterator<V> from(BooleanSupplier hasNext, Supplier<V> next) {
    return new Iterator<V>() {
      @Override
      public boolean hasNext() {
        return hasNext.getAsBoolean();
      }

      @Override
      public V next() {
        return next.get();
      }
    };
  }

  /**
   * @param it an iterator
   * @param f  a function which transforms values
   * @return an iterator which yields the transformed values
   */
  public static <U, V> Iterator<V> map(Iterator<U> it, Function<U, V> f) {
    return from(it::hasNext, () -> f.apply(it.next()));
  }

  public static <V> Stream<V> toStream(Iterator<V> it) {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED), false);
  }
}
