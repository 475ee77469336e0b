package io.intellixity.sift.selector;

import java.util.Arrays;

/** Static helpers for building selector trees in code. */
public final class Selectors {
  private Selectors() {}

  public static Statement eq(String field, Object value) { return Statement.of(field, ComparisonOperator.EQ, value); }
  public static Statement ne(String field, Object value) { return Statement.of(field, ComparisonOperator.NE, value); }
  public static Statement lt(String field, Object value) { return Statement.of(field, ComparisonOperator.LT, value); }
  public static Statement lte(String field, Object value) { return Statement.of(field, ComparisonOperator.LTE, value); }
  public static Statement gt(String field, Object value) { return Statement.of(field, ComparisonOperator.GT, value); }
  public static Statement gte(String field, Object value) { return Statement.of(field, ComparisonOperator.GTE, value); }

  /** Inclusive range on one field, expressed as {@code $gte} then {@code $lte} in a single statement. */
  public static Statement between(String field, Object lower, Object upper) {
    return Statement.builder().gte(field, lower).lte(field, upper).build();
  }

  public static OperatorNode and(SelectorNode... children) {
    return new OperatorNode(Connective.AND, Arrays.asList(children));
  }

  public static OperatorNode or(SelectorNode... children) {
    return new OperatorNode(Connective.OR, Arrays.asList(children));
  }

  public static Selector selector(SelectorNode root) { return Selector.of(root); }
}
