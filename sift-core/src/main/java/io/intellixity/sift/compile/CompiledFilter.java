package io.intellixity.sift.compile;

import java.util.*;

/**
 * Result of compiling a selector: a boolean SQL expression with {@code :name} placeholders, the values
 * bound to those placeholders, and the fields the expression references.
 */
public record CompiledFilter(String fragment, Map<String, Object> params, Set<String> fields) {
  public static final CompiledFilter EMPTY = new CompiledFilter("", Map.of(), Set.of());

  public CompiledFilter {
    fragment = (fragment == null) ? "" : fragment;
    params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    fields = (fields == null) ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(fields));
  }

  public boolean isEmpty() { return fragment.isEmpty(); }

  /** {@code " WHERE <fragment>"}, or an empty string when there is nothing to filter on. */
  public String whereClause() {
    return isEmpty() ? "" : " WHERE " + fragment;
  }
}
