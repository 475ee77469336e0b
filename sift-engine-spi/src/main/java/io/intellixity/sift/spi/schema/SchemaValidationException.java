package io.intellixity.sift.spi.schema;

import java.util.List;

/**
 * Raised by {@link SchemaGuard} when a request references a table or fields the catalog does not have.
 * <p>
 * The whole request must be discarded; nothing of it may be executed.
 */
public final class SchemaValidationException extends RuntimeException {
  private final String table;
  private final List<String> unknownFields;

  public SchemaValidationException(String message, String table, List<String> unknownFields) {
    super(message);
    this.table = table;
    this.unknownFields = unknownFields == null ? List.of() : List.copyOf(unknownFields);
  }

  public String table() { return table; }

  /** Sorted unknown field names; empty when the table itself is unknown. */
  public List<String> unknownFields() { return unknownFields; }
}
