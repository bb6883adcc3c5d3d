package io.intellixity.relq.sql.builder;

import io.intellixity.relq.query.*;
import io.intellixity.relq.sql.SqlStatement;
import io.intellixity.relq.sql.dialect.SqliteDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relq.query.QueryFilters.*;
import static io.intellixity.relq.sql.fixtures.TestEntities.*;
import static org.junit.jupiter.api.Assertions.*;

final class FilterQueryBuilderTest {
  private static final String SELECT =
      "SELECT " + columns(TEST_ENTITY_METADATA, "TestEntity") + " FROM \"test_entity\" \"TestEntity\"";

  private final FilterQueryBuilder builder = new FilterQueryBuilder(registry(), new SqliteDialect(), "TestEntity");

  @Test
  void selectsEverythingWithoutAQuery() {
    SqlStatement st = builder.select(null);
    assertEquals(SELECT, st.sql());
    assertEquals(List.of(), st.parameters());
  }

  @Test
  void appliesFilterSortAndPage() {
    SqlStatement st = builder.select(Query.of(eq("stringType", "test"))
        .withSort(SortField.desc("numberType"))
        .withPage(Paging.of(5, 10)));
    assertEquals(SELECT + " WHERE \"TestEntity\".\"string_type\" = ?" +
        " ORDER BY \"TestEntity\".\"number_type\" DESC LIMIT 5 OFFSET 10", st.sql());
    assertEquals(List.of("test"), st.parameters());
  }

  @Test
  void composesRelationSubQueryFilters() {
    Query q = Query.of(eq("stringType", "test"))
        .withRelation("oneTestRelation", Query.of(eq("relationName", "foo")));
    SqlStatement st = builder.select(q);
    assertEquals(SELECT +
        " LEFT JOIN \"test_relation\" \"TestEntity_oneTestRelation\"" +
        " ON \"TestEntity_oneTestRelation\".\"test_relation_pk\" = \"TestEntity\".\"one_test_relation_id\"" +
        " WHERE (\"TestEntity\".\"string_type\" = ?) AND (\"TestEntity_oneTestRelation\".\"relation_name\" = ?)", st.sql());
    assertEquals(List.of("test", "foo"), st.parameters());
  }

  @Test
  void nestedRelationSubQueriesJoinBelowTheirParent() {
    Query q = new Query().withRelation("manyTestRelations",
        new Query().withRelation("testEntity", Query.of(isNotNull("dateType"))));
    SqlStatement st = builder.select(q);
    assertTrue(st.sql().contains(" LEFT JOIN \"test_entity\" \"TestEntity_manyTestRelations_testEntity\"" +
        " ON \"TestEntity_manyTestRelations_testEntity\".\"test_entity_pk\" = \"TestEntity_manyTestRelations\".\"test_entity_id\""));
    assertTrue(st.sql().endsWith(" WHERE \"TestEntity_manyTestRelations_testEntity\".\"date_type\" IS NOT NULL"));
    assertEquals(List.of(), st.parameters());
  }

  @Test
  void filterAndSortOnTheSameRelationShareOneJoin() {
    Query q = Query.of(relation("testRelations", like("relationName", "a%")))
        .withSort(SortField.asc("testRelations.relationName"));
    SqlStatement st = builder.select(q);
    assertEquals(1, RelationQueryBuilderTest.occurrences(st.sql(), " JOIN "));
    assertTrue(st.sql().endsWith(" WHERE \"TestEntity_testRelations\".\"relation_name\" LIKE ?" +
        " ORDER BY \"TestEntity_testRelations\".\"relation_name\" ASC"));
  }

  @Test
  void selectByIdPutsThePrimaryKeyFirst() {
    SqlStatement st = builder.selectById("test-entity-id-1", Query.of(eq("boolType", true)));
    assertEquals(SELECT + " WHERE (\"TestEntity\".\"test_entity_pk\" = ?) AND (\"TestEntity\".\"bool_type\" = ?)", st.sql());
    assertEquals(List.of("test-entity-id-1", true), st.parameters());
  }

  @Test
  void selectByIdRequiresAnId() {
    assertThrows(IllegalArgumentException.class, () -> builder.selectById(null, null));
  }

  @Test
  void countIgnoresSortAndPage() {
    SqlStatement st = builder.count(Query.of(relation("testRelations", eq("relationName", "x")))
        .withSort(SortField.asc("stringType"))
        .withPage(Paging.limit(1)));
    assertEquals("SELECT COUNT(DISTINCT \"TestEntity\".\"test_entity_pk\") AS \"count\"" +
        " FROM \"test_entity\" \"TestEntity\"" +
        " LEFT JOIN \"test_relation\" \"TestEntity_testRelations\"" +
        " ON \"TestEntity_testRelations\".\"test_entity_id\" = \"TestEntity\".\"test_entity_pk\"" +
        " WHERE \"TestEntity_testRelations\".\"relation_name\" = ?", st.sql());
    assertEquals(List.of("x"), st.parameters());
  }

  @Test
  void unknownEntityFails() {
    assertThrows(IllegalArgumentException.class, () -> new FilterQueryBuilder(registry(), new SqliteDialect(), "Nope"));
  }

  @Test
  void unknownRelationSubQueryFails() {
    RelationNotFoundException ex = assertThrows(RelationNotFoundException.class,
        () -> builder.select(new Query().withRelation("nope", null)));
    assertEquals("TestEntity", ex.entity());
  }

  @Test
  void valuesAreNeverInlined() {
    SqlStatement st = builder.select(Query.of(eq("stringType", "'; DROP TABLE test_entity; --")));
    assertFalse(st.sql().contains("DROP"));
    assertEquals(1, st.parameters().size());
  }
}
