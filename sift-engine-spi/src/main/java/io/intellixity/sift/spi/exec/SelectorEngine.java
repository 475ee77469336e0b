package io.intellixity.sift.spi.exec;

import io.intellixity.sift.spi.sql.Aggregate;

import java.util.List;
import java.util.Map;

/** Reads table rows filtered by a selector, after validating the request against the catalog. */
public interface SelectorEngine {
  List<String> tables();

  /** Column names of a known table, in catalog order. */
  List<String> columns(String table);

  /** Rows as column label -> value maps, in the order the database returns them. */
  List<Map<String, Object>> select(TableQuery query);

  long count(TableQuery query);

  /**
   * {@code aggregate(column)} over the rows matching the query's selector; the projection is ignored.
   * Null when the database returns no value (e.g. SUM over no rows).
   */
  Object aggregate(TableQuery query, Aggregate aggregate, String column);
}
