package io.intellixity.sift.spi.exec;

import io.intellixity.sift.compile.CompiledFilter;
import io.intellixity.sift.compile.FilterCompiler;
import io.intellixity.sift.compile.PlaceholderNaming;
import io.intellixity.sift.spi.schema.SchemaGuard;
import io.intellixity.sift.spi.schema.SchemaIntrospector;
import io.intellixity.sift.spi.sql.Aggregate;
import io.intellixity.sift.spi.sql.Dialect;
import io.intellixity.sift.spi.sql.NamedSql;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method orchestrator for selector reads.\n
 *
 * Per call:\n
 * - compile the selector with a fresh {@link FilterCompiler}, fields quoted by the dialect\n
 * - validate table, projection and filter fields through {@link SchemaGuard}\n
 * - render the statement with the {@link Dialect}\n
 * - delegate execution to backend hooks\n
 */
public abstract class AbstractSelectorEngine implements SelectorEngine {
  private final Dialect dialect;
  private final SchemaIntrospector schema;
  private final SchemaGuard guard;
  private final PlaceholderNaming naming;

  protected AbstractSelectorEngine(Dialect dialect, SchemaIntrospector schema, PlaceholderNaming naming) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.guard = new SchemaGuard(schema);
    this.naming = (naming == null) ? PlaceholderNaming.PER_FIELD : naming;
  }

  protected AbstractSelectorEngine(Dialect dialect, SchemaIntrospector schema) {
    this(dialect, schema, PlaceholderNaming.PER_FIELD);
  }

  /** Backend-specific row read. */
  protected abstract List<Map<String, Object>> executeSelect(NamedSql statement);

  /** Backend-specific single-value count read. */
  protected abstract long executeCount(NamedSql statement);

  /** Backend-specific read of the first column of the first row; null when there is none. */
  protected abstract Object executeScalar(NamedSql statement);

  public final Dialect dialect() { return dialect; }

  @Override
  public List<String> tables() {
    return schema.allTables();
  }

  @Override
  public List<String> columns(String table) {
    guard.checkColumns(table, List.of());
    return schema.columnsOf(table);
  }

  @Override
  public final List<Map<String, Object>> select(TableQuery query) {
    return executeSelect(prepareSelect(query));
  }

  @Override
  public final long count(TableQuery query) {
    return executeCount(prepareCount(query));
  }

  @Override
  public final Object aggregate(TableQuery query, Aggregate aggregate, String column) {
    return executeScalar(prepareAggregate(query, aggregate, column));
  }

  /** Guarded SELECT for {@code query}; throws before rendering when validation fails. */
  public final NamedSql prepareSelect(TableQuery query) {
    Objects.requireNonNull(query, "query");
    CompiledFilter filter = compileGuarded(query, query.columns());
    return dialect.renderSelect(query.table(), query.columns(), query.distinct(), filter);
  }

  public final NamedSql prepareCount(TableQuery query) {
    Objects.requireNonNull(query, "query");
    CompiledFilter filter = compileGuarded(query, List.of());
    return dialect.renderCount(query.table(), filter);
  }

  /** Guarded aggregate; the column is checked together with the filter fields. */
  public final NamedSql prepareAggregate(TableQuery query, Aggregate aggregate, String column) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(aggregate, "aggregate");
    Objects.requireNonNull(column, "column");
    CompiledFilter filter = compileGuarded(query, List.of(column));
    return dialect.renderAggregate(query.table(), aggregate, column, filter);
  }

  private CompiledFilter compileGuarded(TableQuery query, List<String> columns) {
    CompiledFilter compiled = new FilterCompiler(naming, dialect::quoteIdent).compileSelector(query.selector());
    return guard.check(query.table(), columns, compiled);
  }
}
