package io.intellixity.sift.spi.schema;

/** Raised when catalog metadata cannot be read. */
public final class SchemaIntrospectionException extends RuntimeException {
  public SchemaIntrospectionException(String message) {
    super(message);
  }

  public SchemaIntrospectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
