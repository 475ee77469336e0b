package io.intellixity.sift.spi.schema;

import io.intellixity.sift.spi.schema.internal.ExpiringLruCache;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Caches table and column listings of a delegate introspector.\n
 *
 * Entries expire after {@code ttlMillis}; {@link #invalidate()} drops everything, e.g. after DDL.\n
 */
public final class CachingSchemaIntrospector implements SchemaIntrospector {
  private static final String TABLES_KEY = "";

  private final SchemaIntrospector delegate;
  private final ExpiringLruCache<String, List<String>> tables;
  private final ExpiringLruCache<String, List<String>> columns;

  public CachingSchemaIntrospector(SchemaIntrospector delegate, int maxTables, long ttlMillis) {
    this(delegate, maxTables, ttlMillis, System::currentTimeMillis);
  }

  public CachingSchemaIntrospector(SchemaIntrospector delegate, int maxTables, long ttlMillis, LongSupplier nowMillis) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.tables = new ExpiringLruCache<>(1, ttlMillis, nowMillis);
    this.columns = new ExpiringLruCache<>(maxTables, ttlMillis, nowMillis);
  }

  @Override
  public List<String> allTables() {
    return tables.getOrLoad(TABLES_KEY, k -> List.copyOf(delegate.allTables()));
  }

  @Override
  public List<String> columnsOf(String table) {
    Objects.requireNonNull(table, "table");
    return columns.getOrLoad(table, t -> List.copyOf(delegate.columnsOf(t)));
  }

  public void invalidate() {
    tables.invalidateAll();
    columns.invalidateAll();
  }
}
