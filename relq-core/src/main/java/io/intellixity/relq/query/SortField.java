package io.intellixity.relq.query;

import java.util.Objects;

public record SortField(String field, Direction direction, Nulls nulls) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public SortField(String field, Direction direction) {
    this(field, direction, null);
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public SortField withNulls(Nulls nulls) { return new SortField(field, direction, nulls); }

  public enum Direction { ASC, DESC }

  public enum Nulls {
    NULLS_FIRST("NULLS FIRST"),
    NULLS_LAST("NULLS LAST");

    private final String sql;

    Nulls(String sql) { this.sql = sql; }

    public String sql() { return sql; }
  }
}
