package io.intellixity.relq.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compiled statement: SQL text plus positional parameters.
 * <p>
 * {@code parameters.get(i)} binds the {@code i+1}-th placeholder in {@code sql}. Values are never inlined into
 * the SQL text.
 */
public record SqlStatement(String sql, List<Object> parameters) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // List.copyOf rejects null elements; null parameters are legal binds.
    parameters = (parameters == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
  }
}
