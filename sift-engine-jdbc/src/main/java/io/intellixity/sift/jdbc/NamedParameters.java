package io.intellixity.sift.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexical handling of named parameters (e.g. :age) in SQL text.\n
 *
 * Rules:\n
 * - params are ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a cast, not a param\n
 * - text inside single quotes, double quotes or backticks is left alone (a doubled quote is an escape)\n
 *
 * A placeholder may appear several times; each occurrence becomes its own '?' bound to the same value.\n
 */
public final class NamedParameters {
  private NamedParameters() {}

  /** Values for every placeholder occurrence, in appearance order. Missing params fail. */
  public static List<Object> bindValues(String sql, Map<String, Object> params) {
    if (sql == null) return List.of();
    Map<String, Object> effective = (params == null) ? Map.of() : params;
    List<Object> out = new ArrayList<>();
    scan(sql, new Visitor() {
      @Override public void text(char ch) {}
      @Override public void param(String name) { out.add(required(effective, name)); }
    });
    return out;
  }

  /** Replace every named placeholder with '?'. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    scan(sql, new Visitor() {
      @Override public void text(char ch) { out.append(ch); }
      @Override public void param(String name) { out.append('?'); }
    });
    return out.toString();
  }

  private interface Visitor {
    void text(char ch);
    void param(String name);
  }

  private static void scan(String sql, Visitor v) {
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        v.text(ch);
        if (ch == quote) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            v.text(ch);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        v.text(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          v.text(ch);
          v.text(ch);
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          v.param(sql.substring(start, end));
          i = end - 1;
          continue;
        }
      }

      v.text(ch);
    }
  }

  private static Object required(Map<String, Object> params, String name) {
    if (params.containsKey(name)) return params.get(name);
    throw new IllegalArgumentException("Missing query param: " + name);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
