package io.intellixity.sift.jdbc.dialect;

import io.intellixity.sift.compile.CompiledFilter;
import io.intellixity.sift.spi.sql.Aggregate;
import io.intellixity.sift.spi.sql.NamedSql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-generic rendering of table reads.\n
 *
 * - projection, table and aggregate column are quoted through {@link #quoteIdent(String)}\n
 * - the compiled filter is appended as-is after WHERE; an empty filter adds no clause\n
 * - count wraps the select: SELECT COUNT(1) FROM (...) sift_count\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  @Override
  public NamedSql renderSelect(String table, List<String> columns, boolean distinct, CompiledFilter filter) {
    Objects.requireNonNull(table, "table");
    CompiledFilter f = (filter == null) ? CompiledFilter.EMPTY : filter;
    String sql = "SELECT " + (distinct ? "DISTINCT " : "") + projection(columns)
        + " FROM " + quoteIdent(table) + f.whereClause();
    return new NamedSql(sql, f.params());
  }

  @Override
  public NamedSql renderCount(String table, CompiledFilter filter) {
    NamedSql base = renderSelect(table, List.of(), filter);
    return new NamedSql("SELECT COUNT(1) FROM (" + base.sql() + ") sift_count", base.params());
  }

  @Override
  public NamedSql renderAggregate(String table, Aggregate aggregate, String column, CompiledFilter filter) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(aggregate, "aggregate");
    Objects.requireNonNull(column, "column");
    CompiledFilter f = (filter == null) ? CompiledFilter.EMPTY : filter;
    String sql = "SELECT " + aggregate.sqlFunction() + "(" + quoteIdent(column) + ") FROM " + quoteIdent(table) + f.whereClause();
    return new NamedSql(sql, f.params());
  }

  protected String projection(List<String> columns) {
    if (columns == null || columns.isEmpty()) return "*";
    List<String> quoted = new ArrayList<>(columns.size());
    for (String c : columns) quoted.add(quoteIdent(c));
    return String.join(", ", quoted);
  }
}
