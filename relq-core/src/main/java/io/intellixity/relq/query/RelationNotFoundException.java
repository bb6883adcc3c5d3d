package io.intellixity.relq.query;

/** No relation metadata is declared for a relation name on an entity. */
public final class RelationNotFoundException extends QueryCompilationException {
  private final String entity;
  private final String relation;

  public RelationNotFoundException(String entity, String relation) {
    super("Unable to find entity for relation '" + relation + "'" + (entity == null ? "" : " on '" + entity + "'"));
    this.entity = entity;
    this.relation = relation;
  }

  public String entity() { return entity; }
  public String relation() { return relation; }
}
