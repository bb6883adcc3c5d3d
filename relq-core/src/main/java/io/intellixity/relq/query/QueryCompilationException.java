package io.intellixity.relq.query;

/**
 * Raised when a query cannot be compiled against the entity metadata.
 * <p>
 * Always fatal for the compilation that raised it: no partial statement is produced. Subtypes identify the
 * failing part of the query.
 */
public class QueryCompilationException extends RuntimeException {
  public QueryCompilationException(String message) {
    super(message);
  }

  public QueryCompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
