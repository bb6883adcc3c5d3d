package io.intellixity.relq.sql.builder;

import io.intellixity.relq.query.Clause;
import io.intellixity.relq.sql.compile.FilterCompiler;
import io.intellixity.relq.sql.compile.JoinPlan;

import java.util.ArrayList;
import java.util.List;

/** Clause collector for one SELECT; renders clauses in fixed order and skips empty ones. */
final class SelectSql {
  private final String from;
  private final List<String> select = new ArrayList<>();
  private final List<String> where = new ArrayList<>();
  private String groupBy = "";
  private String orderBy = "";
  private String limit = "";

  SelectSql(String from) {
    this.from = from;
  }

  SelectSql select(List<String> items) { select.addAll(items); return this; }
  SelectSql select(String item) { select.add(item); return this; }

  SelectSql where(String predicate) {
    if (predicate != null && !predicate.isEmpty()) where.add(predicate);
    return this;
  }

  SelectSql groupBy(String expr) { this.groupBy = expr; return this; }
  SelectSql orderBy(String orderBy) { this.orderBy = orderBy; return this; }
  SelectSql limit(String limit) { this.limit = limit; return this; }

  String render(JoinPlan plan) {
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", select))
        .append(" FROM ").append(from);
    String joins = plan.render();
    if (!joins.isEmpty()) sql.append(' ').append(joins);
    if (!where.isEmpty()) sql.append(" WHERE ").append(FilterCompiler.combine(where, Clause.AND));
    if (!groupBy.isEmpty()) sql.append(" GROUP BY ").append(groupBy);
    if (!orderBy.isEmpty()) sql.append(" ORDER BY ").append(orderBy);
    if (!limit.isEmpty()) sql.append(' ').append(limit);
    return sql.toString();
  }
}
