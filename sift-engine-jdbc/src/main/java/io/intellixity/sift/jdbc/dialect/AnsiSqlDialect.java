package io.intellixity.sift.jdbc.dialect;

/** Double-quoted identifiers (PostgreSQL, SQLite, H2, Oracle, ...). */
public final class AnsiSqlDialect extends AbstractJdbcSqlDialect {
  @Override
  public String id() { return "ansi"; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
