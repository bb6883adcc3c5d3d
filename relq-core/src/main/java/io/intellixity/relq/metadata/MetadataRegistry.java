package io.intellixity.relq.metadata;

/**
 * Read-only lookup of entity and relation metadata.
 * <p>
 * Implementations must be safe for concurrent reads; compilations never write to them.
 */
public interface MetadataRegistry {
  /** Fails with {@link IllegalArgumentException} for unknown entity types. */
  EntityMetadata entity(String type);

  /** Fails with {@link io.intellixity.relq.query.RelationNotFoundException} for undeclared relations. */
  default RelationDescriptor relation(String entityType, String relationName) {
    return entity(entityType).relation(relationName);
  }
}
