package io.intellixity.relq.sql.compile;

import java.util.*;

/**
 * Joins of one statement, keyed by relation path.
 * <p>
 * A path is joined at most once; later lookups get the planned {@link Scope} back and emit nothing. Created
 * per compilation and never shared between threads.
 */
public final class JoinPlan {
  private final String rootAlias;
  private final Map<List<String>, Scope> byPath = new HashMap<>();
  private final Set<String> aliases = new HashSet<>();
  private final List<String> clauses = new ArrayList<>();
  private int joins;

  public JoinPlan(String rootAlias) {
    this.rootAlias = Objects.requireNonNull(rootAlias, "rootAlias");
    aliases.add(rootAlias);
  }

  public String rootAlias() { return rootAlias; }

  /** Preferred alias of a relation path: the root alias followed by each path segment. */
  public String aliasFor(List<String> path) {
    if (path == null || path.isEmpty()) return rootAlias;
    return rootAlias + "_" + String.join("_", path);
  }

  /**
   * Reserves {@code preferred}, or {@code preferred_2}, {@code preferred_3}, ... when it is taken. Distinct paths
   * can share a preferred alias ({@code b.c} and a relation named {@code b_c}); the first to be planned keeps it.
   */
  public String allocate(String preferred) {
    Objects.requireNonNull(preferred, "preferred");
    if (aliases.add(preferred)) return preferred;
    for (int n = 2; ; n++) {
      String candidate = preferred + "_" + n;
      if (aliases.add(candidate)) return candidate;
    }
  }

  public Scope find(List<String> path) {
    return byPath.get(path);
  }

  /** Records a relation-path join; {@code joinClauses} are emitted in order. Aliases come from {@link #allocate}. */
  public void register(List<String> path, Scope scope, List<String> joinClauses) {
    List<String> key = List.copyOf(path);
    if (byPath.containsKey(key)) throw new IllegalStateException("Relation path already joined: " + key);
    byPath.put(key, scope);
    clauses.addAll(joinClauses);
    joins++;
  }

  /** Records a join that belongs to no relation path (e.g. a correlation back to an owner table). */
  public void registerUnkeyed(String joinClause) {
    clauses.add(joinClause);
    joins++;
  }

  /** Number of logical joins (a many-to-many counts once). */
  public int size() { return joins; }

  public List<String> clauses() { return Collections.unmodifiableList(clauses); }

  public String render() { return String.join(" ", clauses); }
}
