package io.intellixity.relq.sql.compile;

import io.intellixity.relq.metadata.*;
import io.intellixity.relq.sql.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns relation metadata into JOIN clauses.
 * <p>
 * Join SQL per relation shape (owner = scope the join starts from):
 * <ul>
 *   <li>many-to-one, owning one-to-one: {@code JOIN target t ON t.referenced = owner.fk}</li>
 *   <li>one-to-many, non-owning one-to-one: {@code JOIN target t ON t.fk = owner.referenced}</li>
 *   <li>many-to-many: {@code JOIN junction t_jt ON t_jt.owner_fk = owner.ref JOIN target t ON t.ref = t_jt.target_fk}</li>
 * </ul>
 * Uni-directional relations join the same way. Every path is joined at most once per {@link JoinPlan}, under an
 * alias the plan keeps unique within the statement.
 */
public final class JoinResolver {
  static final String JUNCTION_SUFFIX = "_jt";
  static final String OWNER_SUFFIX = "_owner";

  private final MetadataRegistry registry;
  private final SqlDialect dialect;

  public JoinResolver(MetadataRegistry registry, SqlDialect dialect) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** Joins {@code relation} of the scope's entity, or returns the scope it was already joined under. */
  public Scope resolve(Scope from, String relation, JoinPlan plan, JoinType type) {
    List<String> path = new ArrayList<>(from.path());
    path.add(relation);
    Scope existing = plan.find(path);
    if (existing != null) return existing;

    RelationDescriptor rel = from.entity().relation(relation);
    EntityMetadata target = registry.entity(rel.target());
    JoinKeys keys = keysFor(from.entity(), rel);

    String alias = plan.allocate(plan.aliasFor(path));
    Scope scope = new Scope(alias, target, path);
    if (keys instanceof JoinKeys.Junction j) {
      String junctionAlias = plan.allocate(alias + JUNCTION_SUFFIX);
      plan.register(path, scope, junctionClauses(from.alias(), j, junctionAlias, target, alias, type));
    } else {
      JoinKeys.Direct d = (JoinKeys.Direct) keys;
      plan.register(path, scope, List.of(directClause(from.alias(), d, target, alias, type)));
    }
    return scope;
  }

  /** Joins each relation of {@code relations} in turn, starting at {@code from}. */
  public Scope resolvePath(Scope from, List<String> relations, JoinPlan plan, JoinType type) {
    Scope current = from;
    for (String r : relations) current = resolve(current, r, plan, type);
    return current;
  }

  /**
   * Ties a relation query rooted at the relation's target back to the owning entity.
   * <p>
   * Only joins that are needed to reach the owner key are emitted, as INNER joins. When the owner table must be
   * joined and the relation declares an inverse side, the join is planned under that inverse path so filters on
   * the inverse relation reuse it.
   */
  public Correlation correlate(Scope root, EntityMetadata owner, RelationDescriptor rel, JoinPlan plan) {
    JoinKeys keys = keysFor(owner, rel);

    if (keys instanceof JoinKeys.Junction j) {
      String junctionAlias = plan.allocate(root.alias() + JUNCTION_SUFFIX);
      plan.registerUnkeyed(JoinType.INNER.sql() + " " + table(j.table(), junctionAlias) +
          " ON " + dialect.column(junctionAlias, j.targetColumn()) + " = " + dialect.column(root.alias(), j.targetReferencedColumn()));
      return new Correlation(dialect.column(junctionAlias, j.ownerColumn()), owner.fieldForColumn(j.ownerReferencedColumn()));
    }

    JoinKeys.Direct d = (JoinKeys.Direct) keys;
    if (!d.foreignKeyOnOwner()) {
      // The target row carries the owner's key itself.
      return new Correlation(dialect.column(root.alias(), d.targetColumn()), owner.fieldForColumn(d.ownerColumn()));
    }

    String ownerAlias;
    if (rel.inverseSide() != null) {
      ownerAlias = resolve(root, rel.inverseSide(), plan, JoinType.INNER).alias();
    } else {
      ownerAlias = plan.allocate(root.alias() + OWNER_SUFFIX);
      plan.registerUnkeyed(JoinType.INNER.sql() + " " + table(owner.table(), ownerAlias) +
          " ON " + dialect.column(ownerAlias, d.ownerColumn()) + " = " + dialect.column(root.alias(), d.targetColumn()));
    }
    return new Correlation(dialect.column(ownerAlias, owner.primaryKeyColumn()), owner.primaryKey());
  }

  /** Normalizes a relation's join columns to the declaring entity's point of view. */
  public JoinKeys keysFor(EntityMetadata owner, RelationDescriptor rel) {
    EntityMetadata target = registry.entity(rel.target());
    RelationKind kind = rel.kind();

    if (kind instanceof RelationKind.ManyToOne m) {
      return new JoinKeys.Direct(m.joinColumn(), orPk(m.referencedColumn(), target), true);
    }
    if (kind instanceof RelationKind.OneToOne o) {
      if (o.owning()) return new JoinKeys.Direct(o.joinColumn(), orPk(o.referencedColumn(), target), true);
      if (o.joinColumn() != null) return new JoinKeys.Direct(orPk(o.referencedColumn(), owner), o.joinColumn(), false);
      RelationKind inv = inverse(owner, rel, target).kind();
      if (!(inv instanceof RelationKind.OneToOne io) || !io.owning()) {
        throw new IllegalStateException(mismatch(owner, rel, "an owning one-to-one"));
      }
      return new JoinKeys.Direct(orPk(io.referencedColumn(), owner), io.joinColumn(), false);
    }
    if (kind instanceof RelationKind.OneToMany o) {
      if (o.joinColumn() != null) return new JoinKeys.Direct(orPk(o.referencedColumn(), owner), o.joinColumn(), false);
      RelationKind inv = inverse(owner, rel, target).kind();
      if (!(inv instanceof RelationKind.ManyToOne im)) {
        throw new IllegalStateException(mismatch(owner, rel, "a many-to-one"));
      }
      return new JoinKeys.Direct(orPk(im.referencedColumn(), owner), im.joinColumn(), false);
    }
    if (kind instanceof RelationKind.ManyToMany m) {
      JoinTableSpec jt = m.joinTable();
      boolean owning = m.owning();
      if (jt == null) {
        RelationKind inv = inverse(owner, rel, target).kind();
        if (!(inv instanceof RelationKind.ManyToMany im) || im.joinTable() == null) {
          throw new IllegalStateException(mismatch(owner, rel, "a many-to-many declaring the join table"));
        }
        jt = im.joinTable();
        owning = false;
      }
      if (owning) {
        return new JoinKeys.Junction(jt.table(), jt.joinColumn(), orPk(jt.referencedColumn(), owner),
            jt.inverseJoinColumn(), orPk(jt.inverseReferencedColumn(), target));
      }
      return new JoinKeys.Junction(jt.table(), jt.inverseJoinColumn(), orPk(jt.inverseReferencedColumn(), owner),
          jt.joinColumn(), orPk(jt.referencedColumn(), target));
    }
    throw new IllegalArgumentException("Unsupported relation kind: " + kind);
  }

  private RelationDescriptor inverse(EntityMetadata owner, RelationDescriptor rel, EntityMetadata target) {
    if (rel.inverseSide() == null) {
      throw new IllegalStateException("Relation '" + rel.name() + "' on '" + owner.type() +
          "' declares no join column and no inverse side");
    }
    return target.relation(rel.inverseSide());
  }

  private static String mismatch(EntityMetadata owner, RelationDescriptor rel, String expected) {
    return "Inverse side '" + rel.inverseSide() + "' of relation '" + rel.name() + "' on '" + owner.type() +
        "' must be " + expected;
  }

  private static String orPk(String column, EntityMetadata em) {
    return column != null ? column : em.primaryKeyColumn();
  }

  private String directClause(String ownerAlias, JoinKeys.Direct d, EntityMetadata target, String alias, JoinType type) {
    return type.sql() + " " + table(target.table(), alias) +
        " ON " + dialect.column(alias, d.targetColumn()) + " = " + dialect.column(ownerAlias, d.ownerColumn());
  }

  private List<String> junctionClauses(String ownerAlias, JoinKeys.Junction j, String junctionAlias,
                                       EntityMetadata target, String alias, JoinType type) {
    return List.of(
        type.sql() + " " + table(j.table(), junctionAlias) +
            " ON " + dialect.column(junctionAlias, j.ownerColumn()) + " = " + dialect.column(ownerAlias, j.ownerReferencedColumn()),
        type.sql() + " " + table(target.table(), alias) +
            " ON " + dialect.column(alias, j.targetReferencedColumn()) + " = " + dialect.column(junctionAlias, j.targetColumn())
    );
  }

  private String table(String table, String alias) {
    return dialect.quoteIdent(table) + " " + dialect.quoteIdent(alias);
  }
}
