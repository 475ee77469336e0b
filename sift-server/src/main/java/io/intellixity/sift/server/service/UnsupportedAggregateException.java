package io.intellixity.sift.server.service;

/** Raised for an aggregate function name outside count, sum, min, max, avg (mean). */
public final class UnsupportedAggregateException extends RuntimeException {
  public UnsupportedAggregateException(String name) {
    super("Unsupported aggregate '" + name + "'");
  }
}
