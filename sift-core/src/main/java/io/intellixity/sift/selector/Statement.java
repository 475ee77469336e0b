package io.intellixity.sift.selector;

import java.util.*;

/**
 * Leaf of a selector tree: field -> (operator -> value).
 * <p>
 * Fields and, per field, operators keep insertion order. Setting the same operator twice on one
 * field keeps the first position and the last value.
 * <p>
 * A field may have no comparisons left (all of its conditions were unusable). It is still listed by
 * {@link #fields()} so that schema checks see every field the caller named.
 */
public final class Statement implements SelectorNode {
  private final Map<String, Map<ComparisonOperator, Object>> conditions;

  private Statement(Map<String, Map<ComparisonOperator, Object>> conditions) {
    Map<String, Map<ComparisonOperator, Object>> copy = new LinkedHashMap<>();
    for (var e : conditions.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
    }
    this.conditions = Collections.unmodifiableMap(copy);
  }

  public Map<String, Map<ComparisonOperator, Object>> conditions() { return conditions; }

  public Set<String> fields() { return conditions.keySet(); }

  /** True when no field was named at all. */
  public boolean isEmpty() { return conditions.isEmpty(); }

  /** All comparisons, fields first then operators, in insertion order. */
  public List<Comparison> comparisons() {
    List<Comparison> out = new ArrayList<>();
    for (var fe : conditions.entrySet()) {
      for (var oe : fe.getValue().entrySet()) {
        out.add(new Comparison(fe.getKey(), oe.getKey(), oe.getValue()));
      }
    }
    return out;
  }

  @Override
  public <R> R accept(SelectorVisitor<R> visitor) { return visitor.visit(this); }

  public static Builder builder() { return new Builder(); }

  public static Statement of(String field, ComparisonOperator operator, Object value) {
    return builder().where(field, operator, value).build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Statement other)) return false;
    return conditions.equals(other.conditions);
  }

  @Override
  public int hashCode() { return conditions.hashCode(); }

  @Override
  public String toString() { return "statement" + conditions; }

  public static final class Builder {
    private final Map<String, Map<ComparisonOperator, Object>> conditions = new LinkedHashMap<>();

    private Builder() {}

    public Builder where(String field, ComparisonOperator operator, Object value) {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(value, "value");
      conditions.computeIfAbsent(field, k -> new LinkedHashMap<>()).put(operator, value);
      return this;
    }

    /** Names a field without adding a comparison for it. */
    public Builder field(String field) {
      Objects.requireNonNull(field, "field");
      conditions.computeIfAbsent(field, k -> new LinkedHashMap<>());
      return this;
    }

    public Builder eq(String field, Object value) { return where(field, ComparisonOperator.EQ, value); }
    public Builder ne(String field, Object value) { return where(field, ComparisonOperator.NE, value); }
    public Builder lt(String field, Object value) { return where(field, ComparisonOperator.LT, value); }
    public Builder lte(String field, Object value) { return where(field, ComparisonOperator.LTE, value); }
    public Builder gt(String field, Object value) { return where(field, ComparisonOperator.GT, value); }
    public Builder gte(String field, Object value) { return where(field, ComparisonOperator.GTE, value); }

    public Statement build() { return new Statement(conditions); }
  }
}
