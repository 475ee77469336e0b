package io.intellixity.sift.compile;

import io.intellixity.sift.selector.ComparisonOperator;

/** How bound-parameter names are derived for a comparison. */
public enum PlaceholderNaming {
  /**
   * One placeholder per field ({@code address.city -> address_city}).\n
   * Several comparisons on the same field share it, so the last bound value wins.\n
   */
  PER_FIELD {
    @Override
    public String placeholder(String field, ComparisonOperator operator) {
      return base(field);
    }
  },
  /** One placeholder per field and operator ({@code age_gte}, {@code age_lte}). */
  PER_OPERATOR {
    @Override
    public String placeholder(String field, ComparisonOperator operator) {
      return base(field) + "_" + operator.shortName();
    }
  };

  public abstract String placeholder(String field, ComparisonOperator operator);

  /** Field name with every character outside [A-Za-z0-9_] mapped to '_' ('.' included). */
  private static String base(String field) {
    StringBuilder out = new StringBuilder(field.length() + 1);
    if (field.isEmpty() || Character.isDigit(field.charAt(0))) out.append('_');
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      boolean ident = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
      out.append(ident ? c : '_');
    }
    return out.toString();
  }
}
