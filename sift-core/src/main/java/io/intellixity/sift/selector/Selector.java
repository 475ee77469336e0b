package io.intellixity.sift.selector;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * Root of a filter tree: either empty (no filtering) or a single {@link SelectorNode}.
 * <p>
 * Callers own the tree; compilers only read it.
 */
@JsonSerialize(using = SelectorJsonSerializer.class)
@JsonDeserialize(using = SelectorJsonDeserializer.class)
public final class Selector {
  private static final Selector EMPTY = new Selector(null);

  private final SelectorNode root;

  private Selector(SelectorNode root) {
    this.root = root;
  }

  public static Selector empty() { return EMPTY; }

  public static Selector of(SelectorNode root) {
    return root == null ? EMPTY : new Selector(root);
  }

  /** Root node, or null when empty. */
  public SelectorNode root() { return root; }

  public boolean isEmpty() { return root == null; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Selector other)) return false;
    return Objects.equals(root, other.root);
  }

  @Override
  public int hashCode() { return Objects.hashCode(root); }

  @Override
  public String toString() { return root == null ? "selector{}" : "selector{" + root + "}"; }
}
