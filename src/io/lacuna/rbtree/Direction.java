package io.lacuna.rbtree;

/**
 * The order in which a tree is traversed, relative to its comparator.
 */
public enum Direction {
  FORWARD,
  BACKWARD
}
