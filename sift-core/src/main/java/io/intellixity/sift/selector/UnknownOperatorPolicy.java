package io.intellixity.sift.selector;

/** How {@link SelectorReader} treats tokens and values outside the supported vocabulary. */
public enum UnknownOperatorPolicy {
  /** Drop the offending entry and log it at DEBUG. */
  SKIP,
  /** Throw {@link SelectorValidationException}. */
  REJECT
}
