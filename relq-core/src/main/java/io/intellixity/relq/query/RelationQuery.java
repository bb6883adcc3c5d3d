package io.intellixity.relq.query;

import java.util.Objects;

/** Sub-query scoped to a relation of the enclosing query's entity. */
public record RelationQuery(String name, Query query) {
  public RelationQuery {
    Objects.requireNonNull(name, "name");
    query = (query == null) ? new Query() : query;
  }
}
