package io.intellixity.relq.sql.dialect;

/**
 * SQLite dialect.
 *
 * Relies on the generic defaults; {@code NULLS FIRST/LAST} is native since SQLite 3.30.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  @Override public String id() { return "sqlite"; }
}
