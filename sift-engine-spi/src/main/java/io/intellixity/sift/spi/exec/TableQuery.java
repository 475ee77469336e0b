package io.intellixity.sift.spi.exec;

import io.intellixity.sift.selector.Selector;

import java.util.List;
import java.util.Objects;

/**
 * One table read: optional column projection (empty = all columns), an optional selector and
 * whether duplicate rows are collapsed.
 */
public record TableQuery(String table, List<String> columns, Selector selector, boolean distinct) {
  public TableQuery {
    Objects.requireNonNull(table, "table");
    if (table.isBlank()) throw new IllegalArgumentException("table is blank");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    selector = (selector == null) ? Selector.empty() : selector;
  }

  public TableQuery(String table, List<String> columns, Selector selector) {
    this(table, columns, selector, false);
  }

  public static TableQuery of(String table) {
    return new TableQuery(table, List.of(), Selector.empty());
  }

  public static TableQuery of(String table, Selector selector) {
    return new TableQuery(table, List.of(), selector);
  }

  public TableQuery withColumns(List<String> columns) {
    return new TableQuery(table, columns, selector, distinct);
  }

  public TableQuery withDistinct(boolean distinct) {
    return new TableQuery(table, columns, selector, distinct);
  }
}
