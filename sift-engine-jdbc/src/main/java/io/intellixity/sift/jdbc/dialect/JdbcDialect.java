package io.intellixity.sift.jdbc.dialect;

import io.intellixity.sift.spi.sql.Dialect;

/** SQL dialect for JDBC-family engines. */
public interface JdbcDialect extends Dialect {
  /** Quote a table or column name. */
  String quoteIdent(String ident);
}
