package io.intellixity.sift.spi.schema;

import java.util.List;

/**
 * Read-only view of the database catalog used to validate selectors before any SQL runs.
 * <p>
 * Implementations may block (metadata queries). Failures surface as {@link SchemaIntrospectionException}.
 */
public interface SchemaIntrospector {
  List<String> allTables();

  /** Column names of {@code table}; empty when the table has no columns or does not exist. */
  List<String> columnsOf(String table);
}
