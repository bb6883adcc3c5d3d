package io.intellixity.relq.sql.compile;

import io.intellixity.relq.metadata.EntityMetadata;

import java.util.List;
import java.util.Objects;

/**
 * Column-resolution context: the alias under which {@code entity} is visible and the relation path that led
 * there from the statement root.
 */
public record Scope(String alias, EntityMetadata entity, List<String> path) {
  public Scope {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(entity, "entity");
    path = List.copyOf(path == null ? List.of() : path);
  }

  public static Scope root(String alias, EntityMetadata entity) {
    return new Scope(alias, entity, List.of());
  }
}
