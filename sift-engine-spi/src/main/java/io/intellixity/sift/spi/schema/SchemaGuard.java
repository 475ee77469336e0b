package io.intellixity.sift.spi.schema;

import io.intellixity.sift.compile.CompiledFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Refuses compiled filters (and column projections) that reference a table or fields the catalog does not have.\n
 *
 * - the table must be listed by {@link SchemaIntrospector#allTables()}\n
 * - every referenced field must be listed by {@link SchemaIntrospector#columnsOf(String)}\n
 * - names match exactly (case-sensitive)\n
 *
 * Fails closed: lookup errors propagate and nothing is returned for execution.\n
 */
public final class SchemaGuard {
  private static final Logger log = LoggerFactory.getLogger(SchemaGuard.class);

  private final SchemaIntrospector schema;

  public SchemaGuard(SchemaIntrospector schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Returns {@code compiled} unchanged when every field it references exists in {@code table}. */
  public CompiledFilter check(String table, CompiledFilter compiled) {
    Objects.requireNonNull(compiled, "compiled");
    checkFields(table, compiled.fields());
    return compiled;
  }

  /** Validates a requested column projection together with the filter's fields in one lookup. */
  public CompiledFilter check(String table, Collection<String> columns, CompiledFilter compiled) {
    Objects.requireNonNull(compiled, "compiled");
    Set<String> referenced = new LinkedHashSet<>();
    if (columns != null) referenced.addAll(columns);
    referenced.addAll(compiled.fields());
    checkFields(table, referenced);
    return compiled;
  }

  public void checkColumns(String table, Collection<String> columns) {
    checkFields(table, columns == null ? List.of() : columns);
  }

  public void checkFields(String table, Collection<String> fields) {
    requireKnownTable(table);
    if (fields == null || fields.isEmpty()) return;

    Set<String> known = new HashSet<>(schema.columnsOf(table));
    SortedSet<String> unknown = new TreeSet<>();
    for (String f : fields) {
      if (f == null || !known.contains(f)) unknown.add(String.valueOf(f));
    }
    if (!unknown.isEmpty()) {
      log.debug("Rejecting request on table '{}': unknown fields {}", table, unknown);
      throw new SchemaValidationException(
          "Unknown field(s) " + unknown + " for table '" + table + "'", table, List.copyOf(unknown));
    }
  }

  private void requireKnownTable(String table) {
    if (table == null || table.isBlank()) {
      throw new SchemaValidationException("Blank table name", table, List.of());
    }
    if (!schema.allTables().contains(table)) {
      log.debug("Rejecting request: unknown table '{}'", table);
      throw new SchemaValidationException("Unknown table '" + table + "'", table, List.of());
    }
  }
}
