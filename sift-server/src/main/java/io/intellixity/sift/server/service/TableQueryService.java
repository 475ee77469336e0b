package io.intellixity.sift.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sift.selector.Selector;
import io.intellixity.sift.selector.SelectorReader;
import io.intellixity.sift.spi.exec.SelectorEngine;
import io.intellixity.sift.spi.exec.TableQuery;
import io.intellixity.sift.spi.sql.Aggregate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public final class TableQueryService {
  private final SelectorEngine engine;
  private final SelectorReader reader;

  public TableQueryService(SelectorEngine engine, SelectorReader reader) {
    this.engine = engine;
    this.reader = reader;
  }

  public List<String> tables() {
    return engine.tables();
  }

  public List<String> columns(String table) {
    return engine.columns(table);
  }

  public List<Map<String, Object>> select(String table, List<String> columns, boolean distinct, JsonNode selector) {
    return engine.select(new TableQuery(table, columns, read(selector), distinct));
  }

  public long count(String table, JsonNode selector) {
    return engine.count(TableQuery.of(table, read(selector)));
  }

  public Object aggregate(String table, String function, String column, JsonNode selector) {
    Aggregate aggregate = Aggregate.fromName(function);
    if (aggregate == null) throw new UnsupportedAggregateException(function);
    return engine.aggregate(TableQuery.of(table, read(selector)), aggregate, column);
  }

  private Selector read(JsonNode selector) {
    return (selector == null) ? Selector.empty() : reader.read(selector);
  }
}
