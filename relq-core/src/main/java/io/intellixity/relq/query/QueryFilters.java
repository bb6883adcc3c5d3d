package io.intellixity.relq.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition ne(String property, Object value) { return Condition.of(property, Operator.NE, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition ge(String property, Object value) { return Condition.of(property, Operator.GE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition le(String property, Object value) { return Condition.of(property, Operator.LE, value); }

  public static Condition like(String property, Object value) { return Condition.of(property, Operator.LIKE, value); }
  public static Condition notLike(String property, Object value) { return Condition.of(property, Operator.NOT_LIKE, value); }

  /** Case-insensitive LIKE. Dialects without a native ILIKE compare lower-cased operands. */
  public static Condition iLike(String property, Object value) { return Condition.of(property, Operator.ILIKE, value); }
  public static Condition notILike(String property, Object value) { return Condition.of(property, Operator.NOT_ILIKE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, values); }
  public static Condition nin(String property, Collection<?> values) { return Condition.of(property, Operator.NIN, values); }

  public static Condition isNull(String property) { return Condition.of(property, Operator.IS_NULL, null); }
  public static Condition isNotNull(String property) { return Condition.of(property, Operator.IS_NOT_NULL, null); }

  public static Condition between(String property, Object lower, Object upper) { return Condition.range(property, lower, upper); }

  public static RelationFilter relation(String relation, QueryElement filter) {
    return new RelationFilter(relation, filter);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }
}
