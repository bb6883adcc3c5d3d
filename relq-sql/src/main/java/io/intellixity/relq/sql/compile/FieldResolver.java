package io.intellixity.relq.sql.compile;

import io.intellixity.relq.metadata.EntityMetadata;
import io.intellixity.relq.query.FieldResolutionException;
import io.intellixity.relq.sql.dialect.SqlDialect;

/** Resolves field names and dot paths to qualified columns, joining the relations a path walks through. */
public final class FieldResolver {
  private final JoinResolver joins;
  private final SqlDialect dialect;

  public FieldResolver(JoinResolver joins, SqlDialect dialect) {
    this.joins = joins;
    this.dialect = dialect;
  }

  /** Qualified column for {@code propertyPath} ({@code field} or {@code relation.….field}) in {@code scope}. */
  public String qualify(Scope scope, String propertyPath, JoinPlan plan, JoinType type) {
    if (propertyPath == null || propertyPath.isBlank()) {
      throw new FieldResolutionException(scope.entity().type(), propertyPath,
          "Blank field name on entity '" + scope.entity().type() + "'");
    }
    String[] parts = propertyPath.split("\\.", -1);
    Scope current = scope;
    for (int i = 0; i < parts.length - 1; i++) {
      current = relation(current, parts[i], plan, type);
    }

    String field = parts[parts.length - 1];
    EntityMetadata em = current.entity();
    if (em.hasColumn(field)) return dialect.column(current.alias(), em.column(field));
    if (em.hasRelation(field)) {
      throw new FieldResolutionException(em.type(), field,
          "Field '" + field + "' on entity '" + em.type() + "' is a relation; filter it with a relation filter");
    }
    throw new FieldResolutionException(em.type(), field);
  }

  /** Scope of {@code relation} on the scope's entity; the name must be a declared relation. */
  public Scope relation(Scope scope, String relation, JoinPlan plan, JoinType type) {
    if (!scope.entity().hasRelation(relation)) {
      throw new FieldResolutionException(scope.entity().type(), relation);
    }
    return joins.resolve(scope, relation, plan, type);
  }
}
