package io.intellixity.sift.selector;

/**
 * A node of a selector tree: either a {@link Statement} leaf or an {@link OperatorNode}.
 * <p>
 * Consumers dispatch through {@link SelectorVisitor} rather than inspecting concrete types.
 */
public interface SelectorNode {
  <R> R accept(SelectorVisitor<R> visitor);
}
