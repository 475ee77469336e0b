package io.intellixity.sift.jdbc;

import io.intellixity.sift.spi.sql.NamedSql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** JDBC-ready statement: {@code ?} placeholders and their values in bind order. */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    sql = (sql == null) ? "" : sql;
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }

  /** Rewrite {@code :name} placeholders to {@code ?} and resolve their values in appearance order. */
  public static SqlStatement from(NamedSql named) {
    return new SqlStatement(NamedParameters.toJdbcSql(named.sql()), NamedParameters.bindValues(named.sql(), named.params()));
  }
}
