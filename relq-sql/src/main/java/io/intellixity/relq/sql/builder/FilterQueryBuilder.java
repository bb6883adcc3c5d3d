package io.intellixity.relq.sql.builder;

import io.intellixity.relq.metadata.EntityMetadata;
import io.intellixity.relq.metadata.MetadataRegistry;
import io.intellixity.relq.query.Query;
import io.intellixity.relq.sql.SqlStatement;
import io.intellixity.relq.sql.compile.JoinPlan;
import io.intellixity.relq.sql.compile.Params;
import io.intellixity.relq.sql.compile.Scope;
import io.intellixity.relq.sql.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds statements over one root entity.
 * <p>
 * The root is aliased by its entity type. Relations referenced by filters, sorts or relation sub-queries are
 * LEFT joined once each.
 */
public final class FilterQueryBuilder extends AbstractQueryBuilder {
  private static final Logger log = LoggerFactory.getLogger(FilterQueryBuilder.class);

  private final String entityType;

  public FilterQueryBuilder(MetadataRegistry registry, SqlDialect dialect, String entityType) {
    super(registry, dialect);
    this.entityType = registry.entity(entityType).type();
  }

  public SqlStatement select(Query query) {
    return select(null, orEmpty(query), "select");
  }

  /** {@link #select(Query)} restricted to the row with primary key {@code id}. */
  public SqlStatement selectById(Object id, Query query) {
    if (id == null) throw new IllegalArgumentException("id is required");
    return select(id, orEmpty(query), "selectById");
  }

  /** Counts distinct root rows matching the query's filters; sort and paging are ignored. */
  public SqlStatement count(Query query) {
    Query q = orEmpty(query);
    EntityMetadata em = registry.entity(entityType);
    JoinPlan plan = new JoinPlan(em.type());
    Scope root = Scope.root(plan.rootAlias(), em);
    Params params = new Params(dialect);

    SelectSql sql = from(root)
        .select("COUNT(DISTINCT " + dialect.column(root.alias(), em.primaryKeyColumn()) + ") AS " + dialect.quoteIdent(COUNT_ALIAS));
    applyFilters(sql, root, q, plan, params);
    return done("count", sql, plan, params);
  }

  private SqlStatement select(Object id, Query query, String op) {
    EntityMetadata em = registry.entity(entityType);
    JoinPlan plan = new JoinPlan(em.type());
    Scope root = Scope.root(plan.rootAlias(), em);
    Params params = new Params(dialect);

    SelectSql sql = from(root).select(columns(root));
    if (id != null) sql.where(dialect.column(root.alias(), em.primaryKeyColumn()) + " = " + params.add(id));
    applyFilters(sql, root, query, plan, params);
    applySortAndPage(sql, root, query, plan);
    return done(op, sql, plan, params);
  }

  private SqlStatement done(String op, SelectSql sql, JoinPlan plan, Params params) {
    SqlStatement st = new SqlStatement(sql.render(plan), params.values());
    log.debug("relq.{} entity={} joins={} paramCount={} sql={}", op, entityType, plan.size(), params.size(), st.sql());
    return st;
  }
}
