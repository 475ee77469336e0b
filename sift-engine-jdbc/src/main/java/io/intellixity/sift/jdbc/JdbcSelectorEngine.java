package io.intellixity.sift.jdbc;

import io.intellixity.sift.compile.PlaceholderNaming;
import io.intellixity.sift.jdbc.dialect.JdbcDialect;
import io.intellixity.sift.spi.exec.AbstractSelectorEngine;
import io.intellixity.sift.spi.schema.SchemaIntrospector;
import io.intellixity.sift.spi.sql.NamedSql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/** Executes guarded selector reads over a {@link DataSource}. Rows come back as ordered label -> value maps. */
public final class JdbcSelectorEngine extends AbstractSelectorEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcSelectorEngine.class);

  private final DataSource ds;

  public JdbcSelectorEngine(DataSource ds, JdbcDialect dialect, SchemaIntrospector schema, PlaceholderNaming naming) {
    super(dialect, schema, naming);
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  public JdbcSelectorEngine(DataSource ds, JdbcDialect dialect, SchemaIntrospector schema) {
    this(ds, dialect, schema, PlaceholderNaming.PER_FIELD);
  }

  /** Introspects the connection's default schema directly, without caching. */
  public JdbcSelectorEngine(DataSource ds, JdbcDialect dialect) {
    this(ds, dialect, new JdbcSchemaIntrospector(ds));
  }

  @Override
  protected List<Map<String, Object>> executeSelect(NamedSql statement) {
    SqlStatement ss = SqlStatement.from(statement);
    long start = System.nanoTime();
    debugSql("SELECT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        String[] labels = new String[n];
        for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 0; i < n; i++) row.put(labels[i], rs.getObject(i + 1));
          out.add(row);
        }
        debugDone("SELECT", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new RuntimeException("Failed to execute select: " + ss.sql(), e);
    }
  }

  @Override
  protected long executeCount(NamedSql statement) {
    SqlStatement ss = SqlStatement.from(statement);
    long start = System.nanoTime();
    debugSql("COUNT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0L;
        debugDone("COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new RuntimeException("Failed to execute count: " + ss.sql(), e);
    }
  }

  @Override
  protected Object executeScalar(NamedSql statement) {
    SqlStatement ss = SqlStatement.from(statement);
    long start = System.nanoTime();
    debugSql("AGGREGATE", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        Object v = rs.next() ? rs.getObject(1) : null;
        debugDone("AGGREGATE", v == null ? 0 : 1, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new RuntimeException("Failed to execute aggregate: " + ss.sql(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      ps.setObject(i + 1, ss.binds().get(i));
    }
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("sift.jdbc op={} dialect={} bindCount={} sql={}", op, dialect().id(), ss.binds().size(), ss.sql());

    // TRACE: bind types only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        log.trace("sift.jdbc bind index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sift.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
