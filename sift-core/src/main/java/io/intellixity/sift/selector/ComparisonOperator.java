package io.intellixity.sift.selector;

import java.util.HashMap;
import java.util.Map;

/** Closed set of field comparisons a statement may carry, keyed by their wire token. */
public enum ComparisonOperator {
  EQ("$eq"),
  NE("$ne"),
  LT("$lt"),
  LTE("$lte"),
  GT("$gt"),
  GTE("$gte");

  private static final Map<String, ComparisonOperator> BY_TOKEN = new HashMap<>();

  static {
    for (ComparisonOperator op : values()) BY_TOKEN.put(op.token, op);
  }

  private final String token;

  ComparisonOperator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  /** Lower-case name without the '$' sentinel (e.g. "gte"); used for per-operator placeholder names. */
  public String shortName() { return token.substring(1); }

  /** Resolve a wire token such as {@code "$gte"}; returns null for anything outside the closed set. */
  public static ComparisonOperator fromToken(String token) {
    return token == null ? null : BY_TOKEN.get(token);
  }
}
