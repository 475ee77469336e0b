package io.intellixity.sift.selector;

/**
 * Raised when a selector document is rejected under {@link UnknownOperatorPolicy#REJECT}
 * (unknown operator or connective, non-scalar value, malformed node).
 */
public final class SelectorValidationException extends RuntimeException {
  public SelectorValidationException(String message) {
    super(message);
  }

  public SelectorValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
