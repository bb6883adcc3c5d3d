package io.intellixity.relq.query;

/** Operator and value do not fit together, e.g. a range without two bounds. */
public final class InvalidFilterException extends QueryCompilationException {
  public InvalidFilterException(String message) {
    super(message);
  }
}
