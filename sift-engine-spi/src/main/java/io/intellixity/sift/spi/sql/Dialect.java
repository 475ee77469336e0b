package io.intellixity.sift.spi.sql;

import io.intellixity.sift.compile.CompiledFilter;

import java.util.List;

/** Backend SPI: wraps a compiled filter into full statements for one table. */
public interface Dialect {
  String id();

  /** {@code SELECT [DISTINCT] <columns or *> FROM <table> [WHERE <fragment>]}. */
  NamedSql renderSelect(String table, List<String> columns, boolean distinct, CompiledFilter filter);

  default NamedSql renderSelect(String table, List<String> columns, CompiledFilter filter) {
    return renderSelect(table, columns, false, filter);
  }

  NamedSql renderCount(String table, CompiledFilter filter);

  /** {@code SELECT <fn>(<column>) FROM <table> [WHERE <fragment>]}. */
  NamedSql renderAggregate(String table, Aggregate aggregate, String column, CompiledFilter filter);

  /** Identifier as written into SQL; also applied to filter fields. Unquoted unless overridden. */
  default String quoteIdent(String ident) { return ident; }
}
