package io.intellixity.relq.metadata;

import java.util.Objects;

/**
 * Association table of a many-to-many relation, described from the owning side.
 *
 * @param table                   association table name
 * @param joinColumn              column pointing at the owning entity
 * @param referencedColumn        owning entity column it references; null means the primary key
 * @param inverseJoinColumn       column pointing at the inverse entity
 * @param inverseReferencedColumn inverse entity column it references; null means the primary key
 */
public record JoinTableSpec(String table, String joinColumn, String referencedColumn,
                            String inverseJoinColumn, String inverseReferencedColumn) {
  public JoinTableSpec {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(joinColumn, "joinColumn");
    Objects.requireNonNull(inverseJoinColumn, "inverseJoinColumn");
  }

  public static JoinTableSpec of(String table, String joinColumn, String inverseJoinColumn) {
    return new JoinTableSpec(table, joinColumn, null, inverseJoinColumn, null);
  }
}
