package io.intellixity.relq.sql.mysql;

import io.intellixity.relq.sql.dialect.AbstractSqlDialect;
import io.intellixity.relq.sql.dialect.NullOrdering;

/**
 * MySQL dialect.
 *
 * MySQL has no {@code NULLS FIRST/LAST}, so null placement is emulated. Identifiers use backticks.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  /** Largest LIMIT MySQL accepts; used when only an offset is given. */
  static final String MAX_LIMIT = "18446744073709551615";

  @Override public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public NullOrdering nullOrdering() {
    return NullOrdering.EMULATED;
  }

  @Override
  public String renderLimitOffset(Integer limit, Integer offset) {
    // OFFSET is only valid after a LIMIT.
    if (limit == null && offset != null) return "LIMIT " + MAX_LIMIT + " OFFSET " + offset;
    return super.renderLimitOffset(limit, offset);
  }
}
