package io.intellixity.relq.metadata;

import io.intellixity.relq.query.FieldResolutionException;
import io.intellixity.relq.query.RelationNotFoundException;

import java.util.*;

/**
 * Table mapping of one entity type: its columns and declared relations.
 *
 * @param type       entity type name
 * @param table      table name
 * @param primaryKey primary-key field (single column)
 * @param columns    field name to column name, in select order
 * @param relations  relation name to descriptor
 */
public record EntityMetadata(
    String type,
    String table,
    String primaryKey,
    Map<String, String> columns,
    Map<String, RelationDescriptor> relations
) {
  public EntityMetadata {
    if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required for entity: " + type);
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
    relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
    if (primaryKey == null || !columns.containsKey(primaryKey)) {
      throw new IllegalArgumentException("primaryKey must name a mapped column for entity: " + type);
    }
    for (String name : relations.keySet()) {
      if (columns.containsKey(name)) {
        throw new IllegalArgumentException("'" + name + "' is declared both as column and relation on entity: " + type);
      }
    }
  }

  public boolean hasColumn(String field) { return columns.containsKey(field); }
  public boolean hasRelation(String name) { return relations.containsKey(name); }

  /** Physical column of a field; fails when the field is not mapped. */
  public String column(String field) {
    String c = columns.get(field);
    if (c == null) throw new FieldResolutionException(type, field);
    return c;
  }

  public String primaryKeyColumn() { return columns.get(primaryKey); }

  /** Field mapped to a physical column; fails when no field maps to it. */
  public String fieldForColumn(String column) {
    for (var e : columns.entrySet()) {
      if (e.getValue().equals(column)) return e.getKey();
    }
    throw new FieldResolutionException(type, column,
        "No field of entity '" + type + "' is mapped to column '" + column + "'");
  }

  public RelationDescriptor relation(String name) {
    RelationDescriptor r = relations.get(name);
    if (r == null) throw new RelationNotFoundException(type, name);
    return r;
  }

  public static Builder builder(String type, String table) { return new Builder(type, table); }

  public static final class Builder {
    private final String type;
    private final String table;
    private String primaryKey;
    private final Map<String, String> columns = new LinkedHashMap<>();
    private final Map<String, RelationDescriptor> relations = new LinkedHashMap<>();

    private Builder(String type, String table) {
      this.type = type;
      this.table = table;
    }

    public Builder id(String field, String column) {
      this.primaryKey = field;
      return column(field, column);
    }

    public Builder column(String field, String column) {
      columns.put(field, column);
      return this;
    }

    public Builder relation(String name, String target, RelationKind kind, String inverseSide) {
      if (relations.containsKey(name)) throw new IllegalArgumentException("Duplicate relation '" + name + "' on entity: " + type);
      relations.put(name, new RelationDescriptor(name, target, kind, inverseSide));
      return this;
    }

    public Builder relation(String name, String target, RelationKind kind) {
      return relation(name, target, kind, null);
    }

    public EntityMetadata build() {
      return new EntityMetadata(type, table, primaryKey, columns, relations);
    }
  }
}
