package io.intellixity.sift.spi.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Backend-neutral statement: SQL text with {@code :name} placeholders plus their values. */
public record NamedSql(String sql, Map<String, Object> params) {
  public NamedSql {
    Objects.requireNonNull(sql, "sql");
    params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
