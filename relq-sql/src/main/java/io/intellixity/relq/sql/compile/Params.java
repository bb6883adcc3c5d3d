package io.intellixity.relq.sql.compile;

import io.intellixity.relq.sql.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Positional parameters of one statement, in placeholder order. */
public final class Params {
  private final SqlDialect dialect;
  private final List<Object> values = new ArrayList<>();

  public Params(SqlDialect dialect) {
    this.dialect = dialect;
  }

  /** Binds {@code value} and returns the placeholder to put in its place. */
  public String add(Object value) {
    values.add(value);
    return dialect.placeholder(values.size());
  }

  public int size() { return values.size(); }

  public List<Object> values() { return Collections.unmodifiableList(values); }
}
