package io.intellixity.relq.query;

import java.util.Locale;

public enum Operator {
  EQ("eq", Arity.SINGLE),
  NE("neq", Arity.SINGLE),
  GT("gt", Arity.SINGLE),
  GE("gte", Arity.SINGLE),
  LT("lt", Arity.SINGLE),
  LE("lte", Arity.SINGLE),

  LIKE("like", Arity.SINGLE),
  NOT_LIKE("notLike", Arity.SINGLE),
  ILIKE("iLike", Arity.SINGLE),
  NOT_ILIKE("notILike", Arity.SINGLE),

  IN("in", Arity.LIST),
  NIN("notIn", Arity.LIST),

  IS_NULL("isNull", Arity.NONE),
  IS_NOT_NULL("isNotNull", Arity.NONE),

  RANGE("between", Arity.RANGE);

  /** Shape of the value a condition carries for an operator. */
  public enum Arity { NONE, SINGLE, LIST, RANGE }

  private final String key;
  private final Arity arity;

  Operator(String key, Arity arity) {
    this.key = key;
    this.arity = arity;
  }

  /** Canonical JSON key. */
  public String key() { return key; }
  public Arity arity() { return arity; }

  /**
   * Case-insensitive lookup by JSON key ({@code "notIn"}) or constant name ({@code "NIN"}).
   * Returns null for unknown keys.
   */
  public static Operator fromKey(String key) {
    if (key == null) return null;
    String k = key.trim();
    for (Operator op : values()) {
      if (op.key.equalsIgnoreCase(k) || op.name().equalsIgnoreCase(k)) return op;
    }
    String compact = k.replace("_", "").toLowerCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.name().replace("_", "").toLowerCase(Locale.ROOT).equals(compact)) return op;
    }
    return null;
  }
}
