package io.intellixity.relq.query;

/** A filter or sort field resolves to neither a column nor a relation of its entity. */
public final class FieldResolutionException extends QueryCompilationException {
  private final String entity;
  private final String field;

  public FieldResolutionException(String entity, String field) {
    this(entity, field, "Unable to resolve field '" + field + "' on entity '" + entity + "'");
  }

  public FieldResolutionException(String entity, String field, String message) {
    super(message);
    this.entity = entity;
    this.field = field;
  }

  public String entity() { return entity; }
  public String field() { return field; }
}
