package io.intellixity.relq.sql.compile;

import io.intellixity.relq.query.InvalidPagingException;
import io.intellixity.relq.query.Paging;
import io.intellixity.relq.sql.dialect.SqlDialect;

public final class PagingCompiler {
  private final SqlDialect dialect;

  public PagingCompiler(SqlDialect dialect) {
    this.dialect = dialect;
  }

  /** LIMIT/OFFSET clause; empty when there is no window. */
  public String compile(Paging page) {
    if (page == null) return "";
    requireNonNegative("limit", page.limit());
    requireNonNegative("offset", page.offset());
    return dialect.renderLimitOffset(page.limit(), page.offset());
  }

  private static void requireNonNegative(String name, Integer v) {
    if (v != null && v < 0) throw new InvalidPagingException(name + " must be >= 0, got " + v);
  }
}
