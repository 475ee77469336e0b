package io.intellixity.sift.selector;

import java.util.Objects;

/** One field compared against one scalar value. */
public record Comparison(String field, ComparisonOperator operator, Object value) {
  public Comparison {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }
}
