package io.intellixity.relq.sql.postgres;

import io.intellixity.relq.sql.dialect.AbstractSqlDialect;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides: numbered {@code $n} placeholders and native {@code ILIKE}.
 * Null ordering is native, as in the generic base.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String placeholder(int position) {
    return "$" + position;
  }

  @Override
  public String renderCaseInsensitiveLike(String expr, String placeholder, boolean negated) {
    return expr + (negated ? " NOT ILIKE " : " ILIKE ") + placeholder;
  }
}
