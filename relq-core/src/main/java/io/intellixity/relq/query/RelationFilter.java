package io.intellixity.relq.query;

import java.util.Objects;

/**
 * Filter leaf whose field names a declared relation.
 * <p>
 * The nested filter is evaluated against the columns of the joined relation, so it may itself contain
 * further {@code RelationFilter}s.
 */
public final class RelationFilter implements QueryElement {
  private final String relation;
  private final QueryElement filter;

  public RelationFilter(String relation, QueryElement filter) {
    this.relation = Objects.requireNonNull(relation, "relation");
    this.filter = Objects.requireNonNull(filter, "filter");
  }

  public String relation() { return relation; }
  public QueryElement filter() { return filter; }
}
