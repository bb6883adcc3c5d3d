package io.intellixity.relq.sql.dialect;

/**
 * Target-database capabilities the compilers depend on.
 * <p>
 * One instance is selected per target database (see {@link SqlDialects}); implementations are stateless.
 */
public interface SqlDialect {
  String id();

  String quoteIdent(String ident);

  /** Placeholder for the 1-based parameter {@code position}. */
  String placeholder(int position);

  /** How {@code NULLS FIRST}/{@code NULLS LAST} is expressed. */
  NullOrdering nullOrdering();

  /** Case-insensitive LIKE of {@code expr} against an already bound placeholder. */
  String renderCaseInsensitiveLike(String expr, String placeholder, boolean negated);

  /** LIMIT/OFFSET clause without leading space; empty when both are null. Values are non-negative. */
  String renderLimitOffset(Integer limit, Integer offset);

  default String column(String alias, String column) {
    return quoteIdent(alias) + "." + quoteIdent(column);
  }
}
