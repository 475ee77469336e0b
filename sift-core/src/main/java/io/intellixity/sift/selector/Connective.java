package io.intellixity.sift.selector;

/** Logical connective of an {@link OperatorNode}. */
public enum Connective {
  AND("$and", " AND "),
  OR("$or", " OR ");

  private final String token;
  private final String joiner;

  Connective(String token, String joiner) {
    this.token = token;
    this.joiner = joiner;
  }

  public String token() { return token; }

  /** SQL text placed between two parenthesized children. */
  public String joiner() { return joiner; }

  public static Connective fromToken(String token) {
    if (token == null) return null;
    for (Connective c : values()) {
      if (c.token.equals(token)) return c;
    }
    return null;
  }
}
