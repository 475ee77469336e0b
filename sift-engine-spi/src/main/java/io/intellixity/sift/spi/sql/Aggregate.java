package io.intellixity.sift.spi.sql;

import java.util.Locale;

/** Single-column aggregate functions. */
public enum Aggregate {
  COUNT,
  SUM,
  MIN,
  MAX,
  AVG;

  public String sqlFunction() { return name(); }

  /** Case-insensitive lookup; {@code mean} is accepted for {@link #AVG}. Unknown names give null. */
  public static Aggregate fromName(String name) {
    if (name == null) return null;
    String n = name.trim().toUpperCase(Locale.ROOT);
    if (n.equals("MEAN")) return AVG;
    for (Aggregate a : values()) if (a.name().equals(n)) return a;
    return null;
  }
}
