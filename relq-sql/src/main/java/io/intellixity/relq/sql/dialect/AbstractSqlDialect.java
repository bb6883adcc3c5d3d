package io.intellixity.relq.sql.dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic SQL dialect base.
 *
 * Defaults: double-quoted identifiers, {@code ?} placeholders, native null ordering, ILIKE emulated with
 * {@code LOWER()}, and {@code LIMIT n OFFSET m}. DB-specific dialects override the hooks that differ.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String placeholder(int position) {
    return "?";
  }

  @Override
  public NullOrdering nullOrdering() {
    return NullOrdering.NATIVE;
  }

  @Override
  public String renderCaseInsensitiveLike(String expr, String placeholder, boolean negated) {
    return "LOWER(" + expr + ")" + (negated ? " NOT LIKE " : " LIKE ") + "LOWER(" + placeholder + ")";
  }

  @Override
  public String renderLimitOffset(Integer limit, Integer offset) {
    List<String> parts = new ArrayList<>(2);
    if (limit != null) parts.add("LIMIT " + limit);
    if (offset != null) parts.add("OFFSET " + offset);
    return String.join(" ", parts);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
