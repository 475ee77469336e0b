package io.intellixity.sift.jdbc.dialect;

/** Backtick-quoted identifiers (MySQL, MariaDB). */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  @Override
  public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    return "`" + ident.replace("`", "``") + "`";
  }
}
