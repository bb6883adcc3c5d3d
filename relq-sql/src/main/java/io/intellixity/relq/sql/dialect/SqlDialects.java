package io.intellixity.relq.sql.dialect;

import io.intellixity.relq.util.RelqFactoriesLoader;

import java.util.List;

/** Looks up dialects registered under {@code META-INF/relq.factories}. */
public final class SqlDialects {
  private SqlDialects() {}

  public static List<SqlDialect> available() {
    return RelqFactoriesLoader.load(SqlDialect.class);
  }

  public static SqlDialect forId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("dialect id is required");
    List<SqlDialect> all = available();
    for (SqlDialect d : all) {
      if (d.id().equalsIgnoreCase(id.trim())) return d;
    }
    throw new IllegalArgumentException("Unknown SQL dialect '" + id + "'; available: " +
        all.stream().map(SqlDialect::id).toList());
  }
}
