package io.lacuna.rbtree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options shared by {@link OrderedMap} and {@link OrderedSet}.
 */
public class TreeConfig {

  private static final Logger LOG = LoggerFactory.getLogger(TreeConfig.class);

  /**
   * If set to {@code true}, every mutation validates the resulting tree.
   */
  public static final String CHECK_INVARIANTS_PROPERTY = "io.lacuna.rbtree.checkInvariants";

  public static final TreeConfig DEFAULT = builder().build();

  public final boolean checkInvariants;

  private TreeConfig(boolean checkInvariants) {
    this.checkInvariants = checkInvariants;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {

    private boolean checkInvariants = Boolean.getBoolean(CHECK_INVARIANTS_PROPERTY);

    /**
     * Validating a tree takes linear time, so this turns every O(log n) mutation into an O(n) one.
     */
    public Builder checkInvariants(boolean checkInvariants) {
      this.checkInvariants = checkInvariants;
      return this;
    }

    public TreeConfig build() {
      if (checkInvariants) {
        LOG.debug("red-black invariants will be checked after every mutation");
      }
      return new TreeConfig(checkInvariants);
    }
  }

  @Override
  public String toString() {
    return "TreeConfig{checkInvariants=" + checkInvariants + "}";
  }
}
