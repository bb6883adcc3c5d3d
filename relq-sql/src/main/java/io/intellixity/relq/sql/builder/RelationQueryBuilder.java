package io.intellixity.relq.sql.builder;

import io.intellixity.relq.metadata.EntityMetadata;
import io.intellixity.relq.metadata.MetadataRegistry;
import io.intellixity.relq.metadata.RelationDescriptor;
import io.intellixity.relq.pojo.PojoAccessor;
import io.intellixity.relq.query.Query;
import io.intellixity.relq.sql.SqlStatement;
import io.intellixity.relq.sql.compile.Correlation;
import io.intellixity.relq.sql.compile.JoinPlan;
import io.intellixity.relq.sql.compile.Params;
import io.intellixity.relq.sql.compile.Scope;
import io.intellixity.relq.sql.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds statements selecting the rows of one relation of an entity type, for one owner or for a batch of
 * owners.
 * <p>
 * The statement root is the relation's target, aliased by the relation name. Batch statements also select the
 * owner key as {@code relq_owner_key} so callers can regroup rows per owner.
 *
 * @param <E> owner instance type, read through a {@link PojoAccessor}
 */
public final class RelationQueryBuilder<E> extends AbstractQueryBuilder {
  private static final Logger log = LoggerFactory.getLogger(RelationQueryBuilder.class);

  private final String entityType;
  private final String relationName;
  private final PojoAccessor<E> accessor;

  public RelationQueryBuilder(MetadataRegistry registry, SqlDialect dialect, String entityType,
                              String relationName, PojoAccessor<E> accessor) {
    super(registry, dialect);
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.relationName = Objects.requireNonNull(relationName, "relationName");
    this.accessor = Objects.requireNonNull(accessor, "accessor");
  }

  /** Relation rows of a single owner. */
  public SqlStatement select(E entity, Query query) {
    Objects.requireNonNull(entity, "entity");
    return build("select", List.of(entity), orEmpty(query), Mode.SINGLE);
  }

  /** Relation rows of every owner in one statement, tagged with the owner key. */
  public SqlStatement batchSelect(List<E> entities, Query query) {
    requireOwners(entities);
    return build("batchSelect", entities, orEmpty(query), Mode.BATCH);
  }

  /** Number of matching relation rows per owner key; owners without rows are absent from the result. */
  public SqlStatement batchCount(List<E> entities, Query query) {
    requireOwners(entities);
    return build("batchCount", entities, orEmpty(query), Mode.COUNT);
  }

  private enum Mode { SINGLE, BATCH, COUNT }

  private SqlStatement build(String op, List<E> owners, Query query, Mode mode) {
    EntityMetadata owner = registry.entity(entityType);
    RelationDescriptor rel = owner.relation(relationName);
    EntityMetadata target = registry.entity(rel.target());

    JoinPlan plan = new JoinPlan(relationName);
    Scope root = Scope.root(plan.rootAlias(), target);
    Params params = new Params(dialect);
    Correlation corr = compilers.joins().correlate(root, owner, rel, plan);

    SelectSql sql = from(root);
    String ownerKey = corr.keyColumn() + " AS " + dialect.quoteIdent(OWNER_KEY_ALIAS);
    switch (mode) {
      case SINGLE -> sql.select(columns(root));
      case BATCH -> sql.select(columns(root)).select(ownerKey);
      case COUNT -> sql.select(ownerKey)
          .select("COUNT(DISTINCT " + dialect.column(root.alias(), target.primaryKeyColumn()) + ") AS " + dialect.quoteIdent(COUNT_ALIAS))
          .groupBy(corr.keyColumn());
    }

    if (mode == Mode.SINGLE) {
      sql.where(corr.keyColumn() + " = " + params.add(ownerKey(owners.get(0), owner, corr)));
    } else {
      StringJoiner in = new StringJoiner(", ", corr.keyColumn() + " IN (", ")");
      for (E e : owners) in.add(params.add(ownerKey(e, owner, corr)));
      sql.where(in.toString());
    }

    applyFilters(sql, root, query, plan, params);
    if (mode != Mode.COUNT) applySortAndPage(sql, root, query, plan);

    SqlStatement st = new SqlStatement(sql.render(plan), params.values());
    log.debug("relq.{} entity={} relation={} owners={} joins={} paramCount={} sql={}",
        op, entityType, relationName, owners.size(), plan.size(), params.size(), st.sql());
    return st;
  }

  private Object ownerKey(E entity, EntityMetadata owner, Correlation corr) {
    Object v = accessor.get(entity, corr.ownerKeyField());
    if (v == null) {
      throw new IllegalArgumentException("Entity of type '" + owner.type() + "' has no value for '" +
          corr.ownerKeyField() + "' needed to select relation '" + relationName + "'");
    }
    return v;
  }

  private static void requireOwners(List<?> entities) {
    if (entities == null || entities.isEmpty()) throw new IllegalArgumentException("At least one entity is required");
  }
}
