package io.intellixity.relq.metadata;

import java.util.Objects;

/**
 * Metadata of one relation of an entity.
 *
 * @param name        relation (property) name on the declaring entity
 * @param target      entity type the relation points at
 * @param kind        cardinality, ownership and join columns
 * @param inverseSide relation name on the target that navigates back; null for uni-directional relations
 */
public record RelationDescriptor(String name, String target, RelationKind kind, String inverseSide) {
  public RelationDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(kind, "kind");
    if (inverseSide != null && inverseSide.isBlank()) inverseSide = null;
  }

  public boolean bidirectional() { return inverseSide != null; }

  /** True for relations that yield at most one target row per owner. */
  public boolean toOne() {
    return kind instanceof RelationKind.OneToOne || kind instanceof RelationKind.ManyToOne;
  }
}
