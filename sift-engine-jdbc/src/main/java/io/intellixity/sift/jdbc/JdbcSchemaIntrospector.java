package io.intellixity.sift.jdbc;

import io.intellixity.sift.spi.schema.SchemaIntrospectionException;
import io.intellixity.sift.spi.schema.SchemaIntrospector;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Catalog lookups through {@link DatabaseMetaData}; one connection per call. */
public final class JdbcSchemaIntrospector implements SchemaIntrospector {
  private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

  private final DataSource ds;
  private final String schema;

  public JdbcSchemaIntrospector(DataSource ds) {
    this(ds, null);
  }

  /** @param schema schema to search, or null/blank for the connection default */
  public JdbcSchemaIntrospector(DataSource ds, String schema) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String schema() { return schema; }

  @Override
  public List<String> allTables() {
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      List<String> out = new ArrayList<>();
      try (ResultSet rs = md.getTables(null, schema, "%", TABLE_TYPES)) {
        while (rs.next()) out.add(rs.getString("TABLE_NAME"));
      }
      return out;
    } catch (SQLException e) {
      throw new SchemaIntrospectionException("Failed to list tables" + inSchema(), e);
    }
  }

  @Override
  public List<String> columnsOf(String table) {
    Objects.requireNonNull(table, "table");
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      List<String> out = new ArrayList<>();
      // The table argument is a LIKE pattern ('_' matches any character), so keep exact matches only.
      try (ResultSet rs = md.getColumns(null, schema, table, "%")) {
        while (rs.next()) {
          if (table.equals(rs.getString("TABLE_NAME"))) out.add(rs.getString("COLUMN_NAME"));
        }
      }
      return out;
    } catch (SQLException e) {
      throw new SchemaIntrospectionException("Failed to read columns of table '" + table + "'" + inSchema(), e);
    }
  }

  private String inSchema() {
    return schema == null ? "" : " in schema '" + schema + "'";
  }
}
