package io.intellixity.relq.metadata;

import java.util.*;

/**
 * Simple in-memory {@link MetadataRegistry}.
 *
 * Useful for tests, demos and for callers that discover metadata once at startup.
 */
public final class InMemoryMetadataRegistry implements MetadataRegistry {
  private final Map<String, EntityMetadata> entities = new LinkedHashMap<>();

  public InMemoryMetadataRegistry(List<EntityMetadata> metadata) {
    for (EntityMetadata em : metadata) {
      if (entities.putIfAbsent(em.type(), em) != null) {
        throw new IllegalArgumentException("Duplicate entity metadata: " + em.type());
      }
    }
    for (EntityMetadata em : entities.values()) {
      for (RelationDescriptor r : em.relations().values()) {
        if (!entities.containsKey(r.target())) {
          throw new IllegalArgumentException(
              "Relation '" + r.name() + "' on '" + em.type() + "' targets unknown entity: " + r.target());
        }
      }
    }
  }

  public InMemoryMetadataRegistry(EntityMetadata... metadata) {
    this(List.of(metadata));
  }

  @Override
  public EntityMetadata entity(String type) {
    EntityMetadata em = entities.get(type);
    if (em == null) throw new IllegalArgumentException("Unknown entity type: " + type);
    return em;
  }

  public Collection<EntityMetadata> allEntities() { return Collections.unmodifiableCollection(entities.values()); }
}
