package io.intellixity.relq.sql.compile;

import io.intellixity.relq.query.*;
import io.intellixity.relq.sql.dialect.SqlDialect;

import java.util.*;

/**
 * Compiles a filter tree into a SQL boolean expression.
 * <p>
 * Values are bound through {@link Params} in the order their placeholders appear in the returned text.
 * Relations referenced by the filter are LEFT joined through the {@link JoinPlan}. An empty tree compiles to
 * the empty string.
 */
public final class FilterCompiler {
  private final FieldResolver fields;
  private final SqlDialect dialect;

  public FilterCompiler(FieldResolver fields, SqlDialect dialect) {
    this.fields = fields;
    this.dialect = dialect;
  }

  public String compile(QueryElement el, Scope scope, JoinPlan plan, Params params) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      String child = compile(n.element(), scope, plan, params);
      return child.isEmpty() ? "" : "NOT (" + child + ")";
    }

    if (el instanceof LogicalGroup g) {
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = compile(c, scope, plan, params);
        if (!s.isEmpty()) childSql.add(s);
      }
      return combine(childSql, g.clause());
    }

    if (el instanceof RelationFilter rf) {
      Scope joined = fields.relation(scope, rf.relation(), plan, JoinType.LEFT);
      return compile(rf.filter(), joined, plan, params);
    }

    if (el instanceof Condition c) {
      String sql = condition(c, fields.qualify(scope, c.property(), plan, JoinType.LEFT), scope, params);
      return c.not() ? "NOT (" + sql + ")" : sql;
    }

    throw new InvalidFilterException("Unsupported filter element: " + el.getClass().getName());
  }

  /** Joins parenthesized parts with the clause's keyword; a single part is returned as is. */
  public static String combine(List<String> parts, Clause clause) {
    if (parts.isEmpty()) return "";
    if (parts.size() == 1) return parts.get(0);
    String sep = (clause == Clause.OR) ? " OR " : " AND ";
    StringJoiner out = new StringJoiner(sep);
    for (String p : parts) out.add("(" + p + ")");
    return out.toString();
  }

  private String condition(Condition c, String expr, Scope scope, Params params) {
    Object value = c.value();
    return switch (c.operator()) {
      case EQ -> (value == null) ? expr + " IS NULL" : expr + " = " + params.add(value);
      case NE -> (value == null) ? expr + " IS NOT NULL" : expr + " <> " + params.add(value);
      case GT -> compare(expr, ">", c, scope, params);
      case GE -> compare(expr, ">=", c, scope, params);
      case LT -> compare(expr, "<", c, scope, params);
      case LE -> compare(expr, "<=", c, scope, params);
      case LIKE -> compare(expr, "LIKE", c, scope, params);
      case NOT_LIKE -> compare(expr, "NOT LIKE", c, scope, params);
      case ILIKE, NOT_ILIKE -> {
        requireValue(c, scope);
        yield dialect.renderCaseInsensitiveLike(expr, params.add(value), c.operator() == Operator.NOT_ILIKE);
      }
      case IN -> list(expr, "IN", c, scope, params);
      case NIN -> list(expr, "NOT IN", c, scope, params);
      case IS_NULL -> expr + " IS NULL";
      case IS_NOT_NULL -> expr + " IS NOT NULL";
      case RANGE -> range(expr, c, scope, params);
    };
  }

  private static String compare(String expr, String op, Condition c, Scope scope, Params params) {
    requireValue(c, scope);
    return expr + " " + op + " " + params.add(c.value());
  }

  private static void requireValue(Condition c, Scope scope) {
    if (c.value() == null) {
      throw new InvalidFilterException(c.operator().key() + " on '" + c.property() + "' of entity '" +
          scope.entity().type() + "' requires a non-null value");
    }
  }

  private static String list(String expr, String op, Condition c, Scope scope, Params params) {
    List<Object> values = toList(c, scope);
    // x IN () is not valid SQL; keep the predicate's truth value instead.
    if (values.isEmpty()) return c.operator() == Operator.IN ? "1 = 0" : "1 = 1";
    StringJoiner ph = new StringJoiner(", ", "(", ")");
    for (Object v : values) ph.add(params.add(v));
    return expr + " " + op + " " + ph;
  }

  private static String range(String expr, Condition c, Scope scope, Params params) {
    Object lo = c.lower();
    Object hi = c.upper();
    if (lo == null && hi == null && c.value() != null) {
      List<Object> bounds = toList(c, scope);
      if (bounds.size() != 2) {
        throw new InvalidFilterException(c.operator().key() + " on '" + c.property() + "' requires exactly two values, got " + bounds.size());
      }
      lo = bounds.get(0);
      hi = bounds.get(1);
    }
    if (lo == null || hi == null) {
      throw new InvalidFilterException(c.operator().key() + " on '" + c.property() + "' of entity '" +
          scope.entity().type() + "' requires non-null lower and upper bounds");
    }
    return expr + " BETWEEN " + params.add(lo) + " AND " + params.add(hi);
  }

  private static List<Object> toList(Condition c, Scope scope) {
    Object v = c.value();
    if (v instanceof Collection<?> col) return new ArrayList<>(col);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    throw new InvalidFilterException(c.operator().key() + " on '" + c.property() + "' of entity '" +
        scope.entity().type() + "' requires a list of values");
  }
}
