package io.intellixity.sift.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Combines its children with exactly one {@link Connective}. Children keep their given order. */
public final class OperatorNode implements SelectorNode {
  private final Connective connective;
  private final List<SelectorNode> children;

  public OperatorNode(Connective connective, List<? extends SelectorNode> children) {
    this.connective = Objects.requireNonNull(connective, "connective");
    List<SelectorNode> out = new ArrayList<>();
    if (children != null) {
      for (SelectorNode c : children) if (c != null) out.add(c);
    }
    this.children = List.copyOf(out);
  }

  public Connective connective() { return connective; }
  public List<SelectorNode> children() { return children; }

  @Override
  public <R> R accept(SelectorVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OperatorNode other)) return false;
    return connective == other.connective && children.equals(other.children);
  }

  @Override
  public int hashCode() { return Objects.hash(connective, children); }

  @Override
  public String toString() { return connective.token() + children; }
}
