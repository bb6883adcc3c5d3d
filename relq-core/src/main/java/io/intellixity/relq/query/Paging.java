package io.intellixity.relq.query;

/**
 * Offset window. Either bound may be absent.
 * <p>
 * Values are checked when the window is compiled, not here, so a decoded query can be inspected before
 * it is rejected.
 */
public record Paging(Integer limit, Integer offset) {
  public static Paging limit(int limit) { return new Paging(limit, null); }
  public static Paging of(int limit, int offset) { return new Paging(limit, offset); }
}
