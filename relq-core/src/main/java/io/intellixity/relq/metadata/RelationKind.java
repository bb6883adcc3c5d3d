package io.intellixity.relq.metadata;

/**
 * Closed set of relation shapes.
 * <p>
 * Join columns are named from the declaring entity's point of view. Optional columns left {@code null} are
 * derived: a missing referenced column is the primary key of the referenced side, a missing join column on a
 * non-owning side is taken from the inverse relation.
 */
public sealed interface RelationKind
    permits RelationKind.OneToOne, RelationKind.OneToMany, RelationKind.ManyToOne, RelationKind.ManyToMany {

  /**
   * @param owning           whether the declaring entity's table holds the foreign key
   * @param joinColumn       foreign-key column; in the declaring table when owning, in the target table otherwise
   * @param referencedColumn column the foreign key points at
   */
  record OneToOne(boolean owning, String joinColumn, String referencedColumn) implements RelationKind {
    public OneToOne {
      if (owning && (joinColumn == null || joinColumn.isBlank())) {
        throw new IllegalArgumentException("owning one-to-one requires joinColumn");
      }
    }
  }

  /**
   * @param joinColumn       foreign-key column in the target table
   * @param referencedColumn column of the declaring table the foreign key points at
   */
  record OneToMany(String joinColumn, String referencedColumn) implements RelationKind {}

  /**
   * @param joinColumn       foreign-key column in the declaring table
   * @param referencedColumn column of the target table the foreign key points at
   */
  record ManyToOne(String joinColumn, String referencedColumn) implements RelationKind {
    public ManyToOne {
      if (joinColumn == null || joinColumn.isBlank()) throw new IllegalArgumentException("many-to-one requires joinColumn");
    }
  }

  /**
   * @param owning    whether the declaring entity is the owning side of the association table
   * @param joinTable association table, stated from the owning side; may be omitted on the non-owning side
   */
  record ManyToMany(boolean owning, JoinTableSpec joinTable) implements RelationKind {
    public ManyToMany {
      if (owning && joinTable == null) throw new IllegalArgumentException("owning many-to-many requires joinTable");
    }
  }

  static OneToOne oneToOneOwning(String joinColumn) { return new OneToOne(true, joinColumn, null); }
  static OneToOne oneToOneInverse() { return new OneToOne(false, null, null); }
  static OneToMany oneToMany() { return new OneToMany(null, null); }
  static ManyToOne manyToOne(String joinColumn) { return new ManyToOne(joinColumn, null); }
  static ManyToMany manyToMany(JoinTableSpec joinTable) { return new ManyToMany(true, joinTable); }
  static ManyToMany manyToManyInverse() { return new ManyToMany(false, null); }
}
