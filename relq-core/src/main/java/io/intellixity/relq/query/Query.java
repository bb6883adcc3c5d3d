package io.intellixity.relq.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/** Immutable query description; every {@code with*} returns a copy. */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private final QueryElement filter;
  private final List<SortField> sort;
  private final Paging page;
  private final List<RelationQuery> relations;

  public Query() {
    this(null, List.of(), null, List.of());
  }

  private Query(QueryElement filter, List<SortField> sort, Paging page, List<RelationQuery> relations) {
    this.filter = filter;
    this.sort = List.copyOf(sort == null ? List.of() : sort);
    this.page = page;
    this.relations = List.copyOf(relations == null ? List.of() : relations);
  }

  public QueryElement filter() { return filter; }
  public List<SortField> sort() { return sort; }
  public Paging page() { return page; }
  public List<RelationQuery> relations() { return relations; }

  public Query withFilter(QueryElement filter) { return new Query(filter, sort, page, relations); }
  public Query withSort(List<SortField> sort) { return new Query(filter, sort, page, relations); }
  public Query withSort(SortField... sort) { return withSort(List.of(sort)); }
  public Query withPage(Paging page) { return new Query(filter, sort, page, relations); }
  public Query withRelations(List<RelationQuery> relations) { return new Query(filter, sort, page, relations); }

  public Query withRelation(String name, Query query) {
    List<RelationQuery> out = new ArrayList<>(relations);
    out.add(new RelationQuery(name, query));
    return withRelations(out);
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }
}
