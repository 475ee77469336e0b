package io.intellixity.sift.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sift.server.service.TableQueryService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tables")
public final class TableController {
  private final TableQueryService tables;

  public TableController(TableQueryService tables) {
    this.tables = tables;
  }

  /** {"columns": [...], "distinct": true, "selector": {...}}; all optional. */
  public record QueryRequest(List<String> columns, boolean distinct, JsonNode selector) {}

  @GetMapping
  public List<String> list() {
    return tables.tables();
  }

  @GetMapping("/{table}/columns")
  public List<String> columns(@PathVariable("table") String table) {
    return tables.columns(table);
  }

  @PostMapping(value = "/{table}/query", consumes = MediaType.APPLICATION_JSON_VALUE)
  public List<Map<String, Object>> query(@PathVariable("table") String table,
                                         @RequestBody(required = false) QueryRequest req) {
    if (req == null) return tables.select(table, List.of(), false, null);
    return tables.select(table, req.columns(), req.distinct(), req.selector());
  }

  @PostMapping("/{table}/count")
  public long count(@PathVariable("table") String table,
                    @RequestBody(required = false) QueryRequest req) {
    return tables.count(table, req == null ? null : req.selector());
  }

  /** e.g. POST /api/tables/users/aggregate/sum/age; the body may carry a selector. */
  @PostMapping("/{table}/aggregate/{function}/{column}")
  public Map<String, Object> aggregate(@PathVariable("table") String table,
                                       @PathVariable("function") String function,
                                       @PathVariable("column") String column,
                                       @RequestBody(required = false) QueryRequest req) {
    Object value = tables.aggregate(table, function, column, req == null ? null : req.selector());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("function", function);
    out.put("column", column);
    out.put("value", value);
    return out;
  }
}
