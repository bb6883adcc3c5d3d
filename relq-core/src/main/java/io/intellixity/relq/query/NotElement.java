package io.intellixity.relq.query;

import java.util.Objects;

/** Unary NOT for a query subtree (can wrap a {@link Condition}, a {@link LogicalGroup} or a {@link RelationFilter}). */
public final class NotElement implements QueryElement {
  private final QueryElement element;

  public NotElement(QueryElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public QueryElement element() { return element; }
}
