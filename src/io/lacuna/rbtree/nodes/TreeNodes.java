package io.lacuna.rbtree.nodes;

import io.lacuna.rbtree.Direction;
import io.lacuna.rbtree.IEntry;
import io.lacuna.rbtree.utils.Iterators;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

import static io.lacuna.rbtree.nodes.TreeNodes.Color.BLACK;
import static io.lacuna.rbtree.nodes.TreeNodes.Color.RED;

/**
 * Persistent red-black tree nodes. Insertion follows Okasaki's balancing, deletion follows
 * <a href="https://www.cs.kent.ac.uk/people/staff/smk/redblack/rb.html">Kahrs 2001</a>. No node is ever modified
 * once constructed, every edit returns a new root which shares all untouched subtrees with the old one.
 */
@SuppressWarnings("unchecked")
public class TreeNodes {

  public static final Node LEAF = new Node(BLACK, null, null, null, null);

  public enum Color {
    RED,
    BLACK
  }

  public static <K, V> Node<K, V> leaf() {
    return LEAF;
  }

  public static class Node<K, V> {
    public final Color c;
    public final K k;
    public final V v;
    public final Node<K, V> l, r;

    private Node(Color c, Node<K, V> l, K k, V v, Node<K, V> r) {
      this.c = c;
      this.k = k;
      this.v = v;
      this.l = l;
      this.r = r;
    }

    public boolean isLeaf() {
      return l == null;
    }

    public boolean isRed() {
      return c == RED;
    }

    /**
     * @return true if this is a black node with an entry, which excludes the leaf
     */
    public boolean isBlackNode() {
      return c == BLACK && l != null;
    }

    public IEntry<K, V> entry() {
      return IEntry.of(k, v);
    }

    Node<K, V> blacken() {
      return c == RED ? black(l, k, v, r) : this;
    }

    Node<K, V> redden() {
      if (!isBlackNode()) {
        throw new IllegalStateException("only a black node can be reddened, got " + this);
      }
      return red(l, k, v, r);
    }

    @Override
    public String toString() {
      return isLeaf() ? "." : "(" + c + " " + l + " " + k + " " + r + ")";
    }
  }

  /**
   * The result of an edit: the new root, and the value which was replaced or removed, if any.
   */
  public static final class Edit<K, V> {
    public final Node<K, V> root;
    public final V previous;

    Edit(Node<K, V> root, V previous) {
      this.root = root;
      this.previous = previous;
    }
  }

  ///

  public static <K, V> Node<K, V> find(Node<K, V> n, K key, Comparator<K> comparator) {
    for (; ; ) {
      if (n.isLeaf()) {
        return null;
      }

      int cmp = comparator.compare(key, n.k);
      if (cmp < 0) {
        n = n.l;
      } else if (cmp > 0) {
        n = n.r;
      } else {
        return n;
      }
    }
  }

  public static <K, V> Edit<K, V> put(Node<K, V> root, K key, V value, Comparator<K> comparator) {
    Insertion<K, V> ins = new Insertion<>(key, value, comparator);
    return new Edit<>(ins.insert(root).blacken(), ins.previous);
  }

  public static <K, V> Edit<K, V> remove(Node<K, V> root, K key, Comparator<K> comparator) {
    // deletion recolors the search path, so it may only run when the key is present
    if (find(root, key, comparator) == null) {
      return new Edit<>(root, null);
    }

    Removal<K, V> del = new Removal<>(key, comparator);
    return new Edit<>(del.delete(root).blacken(), del.removed);
  }

  private static final class Insertion<K, V> {
    private final K key;
    private final V value;
    private final Comparator<K> comparator;
    private V previous;

    Insertion(K key, V value, Comparator<K> comparator) {
      this.key = key;
      this.value = value;
      this.comparator = comparator;
    }

    Node<K, V> insert(Node<K, V> n) {
      if (n.isLeaf()) {
        return red(n, key, value, n);
      }

      int cmp = comparator.compare(key, n.k);
      if (n.c == BLACK) {
        if (cmp < 0) {
          return balanceLeft(insert(n.l), n.k, n.v, n.r);
        } else if (cmp > 0) {
          return balanceRight(n.l, n.k, n.v, insert(n.r));
        }
      } else {
        if (cmp < 0) {
          return red(insert(n.l), n.k, n.v, n.r);
        } else if (cmp > 0) {
          return red(n.l, n.k, n.v, insert(n.r));
        }
      }

      previous = n.v;
      return node(n.c, n.l, key, value, n.r);
    }
  }

  private static final class Removal<K, V> {
    private final K key;
    private final Comparator<K> comparator;
    private V removed;

    Removal(K key, Comparator<K> comparator) {
      this.key = key;
      this.comparator = comparator;
    }

    // a black subtree comes back one black level short, which the parent repairs
    Node<K, V> delete(Node<K, V> n) {
      if (n.isLeaf()) {
        return n;
      }

      int cmp = comparator.compare(key, n.k);
      if (cmp < 0) {
        Node<K, V> l = delete(n.l);
        return n.l.isBlackNode() ? balLeft(l, n.k, n.v, n.r) : red(l, n.k, n.v, n.r);
      } else if (cmp > 0) {
        Node<K, V> r = delete(n.r);
        return n.r.isBlackNode() ? balRight(n.l, n.k, n.v, r) : red(n.l, n.k, n.v, r);
      } else {
        removed = n.v;
        return append(n.l, n.r);
      }
    }
  }

  ///

  // (B (R (R a x b) y c) z d) | (B (R a x (R b y c)) z d)
  // (R (B a x b) y (B c z d))
  static <K, V> Node<K, V> balanceLeft(Node<K, V> l, K k, V v, Node<K, V> r) {
    if (l.c == RED) {
      if (l.l.c == RED) {
        return red(l.l.blacken(), l.k, l.v, black(l.r, k, v, r));
      }

      if (l.r.c == RED) {
        Node<K, V> lr = l.r;
        return red(black(l.l, l.k, l.v, lr.l), lr.k, lr.v, black(lr.r, k, v, r));
      }
    }

    return black(l, k, v, r);
  }

  // (B a x (R b y (R c z d))) | (B a x (R (R b y c) z d))
  // (R (B a x b) y (B c z d))
  static <K, V> Node<K, V> balanceRight(Node<K, V> l, K k, V v, Node<K, V> r) {
    if (r.c == RED) {
      if (r.r.c == RED) {
        return red(black(l, k, v, r.l), r.k, r.v, r.r.blacken());
      }

      if (r.l.c == RED) {
        Node<K, V> rl = r.l;
        return red(black(l, k, v, rl.l), rl.k, rl.v, black(rl.r, r.k, r.v, r.r));
      }
    }

    return black(l, k, v, r);
  }

  /**
   * Rebuilds a node whose left subtree is one black level short.
   */
  static <K, V> Node<K, V> balLeft(Node<K, V> l, K k, V v, Node<K, V> r) {
    // (R a x b) y c => (R (B a x b) y c)
    if (l.c == RED) {
      return red(l.blacken(), k, v, r);
    }

    // bl x (B a y b) => balance bl x (R a y b)
    if (r.isBlackNode()) {
      return balanceRight(l, k, v, r.redden());
    }

    // bl x (R (B a y b) z c) => (R (B bl x a) y (balance b z (redden c)))
    if (r.c == RED && r.l.isBlackNode()) {
      Node<K, V> rl = r.l;
      return red(black(l, k, v, rl.l), rl.k, rl.v, balanceRight(rl.r, r.k, r.v, r.r.redden()));
    }

    throw new IllegalStateException("cannot rebalance left of " + k);
  }

  /**
   * Rebuilds a node whose right subtree is one black level short.
   */
  static <K, V> Node<K, V> balRight(Node<K, V> l, K k, V v, Node<K, V> r) {
    // a x (R b y c) => (R a x (B b y c))
    if (r.c == RED) {
      return red(l, k, v, r.blacken());
    }

    // (B a x b) y bl => balance (R a x b) y bl
    if (l.isBlackNode()) {
      return balanceLeft(l.redden(), k, v, r);
    }

    // (R a x (B b y c)) z bl => (R (balance (redden a) x b) y (B c z bl))
    if (l.c == RED && l.r.isBlackNode()) {
      Node<K, V> lr = l.r;
      return red(balanceLeft(l.l.redden(), l.k, l.v, lr.l), lr.k, lr.v, black(lr.r, k, v, r));
    }

    throw new IllegalStateException("cannot rebalance right of " + k);
  }

  /**
   * Joins the two children of a removed node, every key in {@code a} precedes every key in {@code b}, and both
   * have the same black height.
   */
  static <K, V> Node<K, V> append(Node<K, V> a, Node<K, V> b) {
    if (a.isLeaf()) {
      return b;
    } else if (b.isLeaf()) {
      return a;
    }

    if (a.c == RED && b.c == RED) {
      Node<K, V> m = append(a.r, b.l);
      if (m.c == RED) {
        return red(red(a.l, a.k, a.v, m.l), m.k, m.v, red(m.r, b.k, b.v, b.r));
      } else {
        return red(a.l, a.k, a.v, red(m, b.k, b.v, b.r));
      }
    } else if (b.c == RED) {
      return red(append(a, b.l), b.k, b.v, b.r);
    } else if (a.c == RED) {
      return red(a.l, a.k, a.v, append(a.r, b));
    } else {
      Node<K, V> m = append(a.r, b.l);
      if (m.c == RED) {
        return red(black(a.l, a.k, a.v, m.l), m.k, m.v, black(m.r, b.k, b.v, b.r));
      } else {
        return balLeft(a.l, a.k, a.v, black(m, b.k, b.v, b.r));
      }
    }
  }

  ///

  public static <K, V> Node<K, V> min(Node<K, V> n) {
    if (n.isLeaf()) {
      return null;
    }

    while (!n.l.isLeaf()) {
      n = n.l;
    }
    return n;
  }

  public static <K, V> Node<K, V> max(Node<K, V> n) {
    if (n.isLeaf()) {
      return null;
    }

    while (!n.r.isLeaf()) {
      n = n.r;
    }
    return n;
  }

  public static long size(Node<?, ?> n) {
    return n.isLeaf() ? 0 : size(n.l) + size(n.r) + 1;
  }

  public static int height(Node<?, ?> n) {
    return n.isLeaf() ? 0 : Math.max(height(n.l), height(n.r)) + 1;
  }

  public static <K, V, U> Node<K, U> mapValues(Node<K, V> n, BiFunction<K, V, U> f) {
    if (n.isLeaf()) {
      return LEAF;
    }
    return node(n.c, mapValues(n.l, f), n.k, f.apply(n.k, n.v), mapValues(n.r, f));
  }

  /**
   * @return the black height of {@code root}, counting the leaves
   * @throws IllegalStateException if the root is red, a red node has a red child, two paths have a different
   *                               number of black nodes, or the keys are not strictly increasing
   */
  public static <K, V> int checkInvariant(Node<K, V> root, Comparator<K> comparator) {
    if (root.c == RED) {
      throw new IllegalStateException("red root: " + root.k);
    }
    return checkInvariant(root, comparator, null, null);
  }

  private static <K, V> int checkInvariant(Node<K, V> n, Comparator<K> comparator, Node<K, V> lower, Node<K, V> upper) {
    if (n.isLeaf()) {
      return 1;
    }

    if (n.v == null) {
      throw new IllegalStateException("no value for " + n.k);
    }

    if (n.c == RED && (n.l.c == RED || n.r.c == RED)) {
      throw new IllegalStateException("red node with red child: " + n.k);
    }

    if ((lower != null && comparator.compare(lower.k, n.k) >= 0)
      || (upper != null && comparator.compare(n.k, upper.k) >= 0)) {
      throw new IllegalStateException("out of order: " + n.k);
    }

    int ld = checkInvariant(n.l, comparator, lower, n);
    int rd = checkInvariant(n.r, comparator, n, upper);

    if (ld != rd) {
      throw new IllegalStateException("black height mismatch under " + n.k + ": " + ld + " != " + rd);
    }

    return n.c == BLACK ? ld + 1 : ld;
  }

  ///

  static <K, V> Node<K, V> red(Node<K, V> l, K k, V v, Node<K, V> r) {
    return new Node<>(RED, l, k, v, r);
  }

  static <K, V> Node<K, V> black(Node<K, V> l, K k, V v, Node<K, V> r) {
    return new Node<>(BLACK, l, k, v, r);
  }

  static <K, V> Node<K, V> node(Color c, Node<K, V> l, K k, V v, Node<K, V> r) {
    return new Node<>(c, l, k, v, r);
  }

  /**
   * A lazy iterator over {@code root}, which holds a work list of subtrees to visit and entries to yield. The list
   * never holds more than three items per level of the tree.
   */
  public static <K, V> Iterator<IEntry<K, V>> iterator(Node<K, V> root, Direction direction) {

    if (root.isLeaf()) {
      return Iterators.EMPTY;
    }

    boolean forward = direction == Direction.FORWARD;

    return new Iterator<IEntry<K, V>>() {
      final ArrayDeque<Object> work = new ArrayDeque<>();
      IEntry<K, V> next = null;

      {
        work.push(root);
      }

      private void prime() {
        while (next == null && !work.isEmpty()) {
          Object item = work.pop();
          if (item instanceof Node) {
            Node<K, V> n = (Node<K, V>) item;
            if (n.isLeaf()) {
              continue;
            }
            work.push(forward ? n.r : n.l);
            work.push(n.entry());
            work.push(forward ? n.l : n.r);
          } else {
            next = (IEntry<K, V>) item;
          }
        }
      }

      @Override
      public boolean hasNext() {
        prime();
        return next != null;
      }

      @Override
      public IEntry<K, V> next() {
        prime();
        if (next == null) {
          throw new NoSuchElementException();
        }
        IEntry<K, V> e = next;
        next = null;
        return e;
      }
    };
  }
}
