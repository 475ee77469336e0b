package io.intellixity.sift.selector;

public interface SelectorVisitor<R> {
  R visit(Statement statement);
  R visit(OperatorNode operator);
}
