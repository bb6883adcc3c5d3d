package io.intellixity.relq.query;

/** Negative or non-integer limit/offset. */
public final class InvalidPagingException extends QueryCompilationException {
  public InvalidPagingException(String message) {
    super(message);
  }

  public InvalidPagingException(String message, Throwable cause) {
    super(message, cause);
  }
}
