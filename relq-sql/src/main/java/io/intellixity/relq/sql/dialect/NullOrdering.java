package io.intellixity.relq.sql.dialect;

import io.intellixity.relq.query.SortField;

/** Strategy for rendering one ORDER BY entry with an optional null placement. */
public enum NullOrdering {
  /** Dialect understands {@code NULLS FIRST}/{@code NULLS LAST}. */
  NATIVE {
    @Override
    public String render(String expr, SortField.Direction direction, SortField.Nulls nulls) {
      String term = expr + " " + direction.name();
      return nulls == null ? term : term + " " + nulls.sql();
    }
  },

  /**
   * Dialect has no null-ordering syntax: a CASE key sorted ahead of the column moves NULL rows to the
   * requested edge independently of the column's direction.
   */
  EMULATED {
    @Override
    public String render(String expr, SortField.Direction direction, SortField.Nulls nulls) {
      String term = expr + " " + direction.name();
      if (nulls == null) return term;
      String nullRank = (nulls == SortField.Nulls.NULLS_FIRST) ? "0" : "1";
      String valueRank = (nulls == SortField.Nulls.NULLS_FIRST) ? "1" : "0";
      return "CASE WHEN " + expr + " IS NULL THEN " + nullRank + " ELSE " + valueRank + " END, " + term;
    }
  };

  public abstract String render(String expr, SortField.Direction direction, SortField.Nulls nulls);
}
