package io.intellixity.relq.sql.compile;

/** Join columns of a relation, normalized to the declaring (owner) entity's point of view. */
public sealed interface JoinKeys permits JoinKeys.Direct, JoinKeys.Junction {

  /**
   * {@code target.targetColumn = owner.ownerColumn}.
   *
   * @param foreignKeyOnOwner true when {@code ownerColumn} is the foreign key (many-to-one, owning one-to-one)
   */
  record Direct(String ownerColumn, String targetColumn, boolean foreignKeyOnOwner) implements JoinKeys {}

  /**
   * {@code junction.ownerColumn = owner.ownerReferencedColumn} and
   * {@code target.targetReferencedColumn = junction.targetColumn}.
   */
  record Junction(String table, String ownerColumn, String ownerReferencedColumn,
                  String targetColumn, String targetReferencedColumn) implements JoinKeys {}
}
