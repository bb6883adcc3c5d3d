package io.intellixity.relq.sql.builder;

import io.intellixity.relq.metadata.EntityMetadata;
import io.intellixity.relq.metadata.MetadataRegistry;
import io.intellixity.relq.query.Query;
import io.intellixity.relq.query.RelationQuery;
import io.intellixity.relq.sql.compile.*;
import io.intellixity.relq.sql.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing of the query builders: column lists, WHERE composition of a query and its relation
 * sub-queries, ORDER BY and LIMIT/OFFSET.
 */
abstract class AbstractQueryBuilder {
  static final String OWNER_KEY_ALIAS = "relq_owner_key";
  static final String COUNT_ALIAS = "count";

  protected final MetadataRegistry registry;
  protected final SqlDialect dialect;
  protected final Compilers compilers;

  protected AbstractQueryBuilder(MetadataRegistry registry, SqlDialect dialect) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.compilers = Compilers.of(registry, dialect);
  }

  protected SelectSql from(Scope root) {
    return new SelectSql(dialect.quoteIdent(root.entity().table()) + " " + dialect.quoteIdent(root.alias()));
  }

  /** {@code "alias"."column" AS "field"} for every mapped field of the scope's entity. */
  protected List<String> columns(Scope scope) {
    EntityMetadata em = scope.entity();
    List<String> out = new ArrayList<>(em.columns().size());
    for (var e : em.columns().entrySet()) {
      out.add(dialect.column(scope.alias(), e.getValue()) + " AS " + dialect.quoteIdent(e.getKey()));
    }
    return out;
  }

  /**
   * Adds the query's filter, then each relation sub-query's filter scoped to that relation's alias. Relation
   * sub-queries nest: their own {@code relations} are resolved below the relation. An undeclared relation name
   * fails with {@link io.intellixity.relq.query.RelationNotFoundException}.
   */
  protected void applyFilters(SelectSql sql, Scope scope, Query query, JoinPlan plan, Params params) {
    sql.where(compilers.filters().compile(query.filter(), scope, plan, params));
    for (RelationQuery rq : query.relations()) {
      Scope joined = compilers.joins().resolve(scope, rq.name(), plan, JoinType.LEFT);
      applyFilters(sql, joined, rq.query(), plan, params);
    }
  }

  protected void applySortAndPage(SelectSql sql, Scope scope, Query query, JoinPlan plan) {
    sql.orderBy(compilers.sorts().compile(query.sort(), scope, plan));
    sql.limit(compilers.paging().compile(query.page()));
  }

  protected static Query orEmpty(Query query) {
    return query == null ? new Query() : query;
  }
}
