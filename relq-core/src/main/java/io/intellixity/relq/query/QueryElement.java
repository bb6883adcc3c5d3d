package io.intellixity.relq.query;

/** Node of a filter tree: {@link Condition}, {@link LogicalGroup}, {@link NotElement} or {@link RelationFilter}. */
public interface QueryElement {
}
