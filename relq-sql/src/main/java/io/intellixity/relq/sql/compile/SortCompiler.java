package io.intellixity.relq.sql.compile;

import io.intellixity.relq.query.SortField;
import io.intellixity.relq.sql.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.List;

/** Compiles sort fields into an ORDER BY list, keeping their order. Null placement follows the dialect. */
public final class SortCompiler {
  private final FieldResolver fields;
  private final SqlDialect dialect;

  public SortCompiler(FieldResolver fields, SqlDialect dialect) {
    this.fields = fields;
    this.dialect = dialect;
  }

  /** ORDER BY list without the keyword; empty for no sort fields. */
  public String compile(List<SortField> sort, Scope scope, JoinPlan plan) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>(sort.size());
    for (SortField sf : sort) {
      String expr = fields.qualify(scope, sf.field(), plan, JoinType.LEFT);
      parts.add(dialect.nullOrdering().render(expr, sf.direction(), sf.nulls()));
    }
    return String.join(", ", parts);
  }
}
