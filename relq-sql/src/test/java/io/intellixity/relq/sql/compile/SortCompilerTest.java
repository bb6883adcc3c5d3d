package io.intellixity.relq.sql.compile;

import io.intellixity.relq.query.FieldResolutionException;
import io.intellixity.relq.query.SortField;
import io.intellixity.relq.sql.dialect.AbstractSqlDialect;
import io.intellixity.relq.sql.dialect.NullOrdering;
import io.intellixity.relq.sql.dialect.SqlDialect;
import io.intellixity.relq.sql.dialect.SqliteDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relq.query.SortField.Nulls.NULLS_FIRST;
import static io.intellixity.relq.query.SortField.Nulls.NULLS_LAST;
import static io.intellixity.relq.sql.fixtures.TestEntities.TEST_ENTITY_METADATA;
import static io.intellixity.relq.sql.fixtures.TestEntities.registry;
import static org.junit.jupiter.api.Assertions.*;

final class SortCompilerTest {
  private static final SqlDialect EMULATING = new AbstractSqlDialect() {
    @Override public String id() { return "emulating"; }
    @Override public NullOrdering nullOrdering() { return NullOrdering.EMULATED; }
  };

  private static String compile(SqlDialect dialect, JoinPlan plan, SortField... sort) {
    return Compilers.of(registry(), dialect).sorts()
        .compile(List.of(sort), Scope.root("TestEntity", TEST_ENTITY_METADATA), plan);
  }

  private static String compile(SqlDialect dialect, SortField... sort) {
    return compile(dialect, new JoinPlan("TestEntity"), sort);
  }

  @Test
  void noSortFieldsCompileToNothing() {
    assertEquals("", compile(new SqliteDialect()));
  }

  @Test
  void nativeNullOrdering() {
    SqlDialect d = new SqliteDialect();
    assertEquals("\"TestEntity\".\"string_type\" ASC", compile(d, SortField.asc("stringType")));
    assertEquals("\"TestEntity\".\"string_type\" DESC NULLS FIRST",
        compile(d, SortField.desc("stringType").withNulls(NULLS_FIRST)));
    assertEquals("\"TestEntity\".\"string_type\" ASC NULLS LAST",
        compile(d, SortField.asc("stringType").withNulls(NULLS_LAST)));
  }

  @Test
  void emulatedNullOrderingPrefixesACaseKey() {
    assertEquals("CASE WHEN \"TestEntity\".\"string_type\" IS NULL THEN 0 ELSE 1 END, \"TestEntity\".\"string_type\" DESC",
        compile(EMULATING, SortField.desc("stringType").withNulls(NULLS_FIRST)));
    assertEquals("CASE WHEN \"TestEntity\".\"string_type\" IS NULL THEN 1 ELSE 0 END, \"TestEntity\".\"string_type\" DESC",
        compile(EMULATING, SortField.desc("stringType").withNulls(NULLS_LAST)));
  }

  @Test
  void emulatedKeyDoesNotDependOnDirection() {
    String asc = compile(EMULATING, SortField.asc("numberType").withNulls(NULLS_LAST));
    String desc = compile(EMULATING, SortField.desc("numberType").withNulls(NULLS_LAST));
    assertEquals(asc.substring(0, asc.indexOf(',')), desc.substring(0, desc.indexOf(',')));
  }

  @Test
  void emulatedWithoutNullsIsPlain() {
    assertEquals("\"TestEntity\".\"number_type\" ASC", compile(EMULATING, SortField.asc("numberType")));
  }

  @Test
  void keepsFieldOrder() {
    assertEquals("\"TestEntity\".\"number_type\" DESC, \"TestEntity\".\"string_type\" ASC",
        compile(new SqliteDialect(), SortField.desc("numberType"), SortField.asc("stringType")));
  }

  @Test
  void sortOnRelationFieldLeftJoinsItOnce() {
    JoinPlan plan = new JoinPlan("TestEntity");
    String sql = compile(new SqliteDialect(), plan,
        SortField.asc("oneTestRelation.relationName"), SortField.desc("oneTestRelation.testRelationPk"));
    assertEquals("\"TestEntity_oneTestRelation\".\"relation_name\" ASC, \"TestEntity_oneTestRelation\".\"test_relation_pk\" DESC", sql);
    assertEquals(List.of("LEFT JOIN \"test_relation\" \"TestEntity_oneTestRelation\"" +
        " ON \"TestEntity_oneTestRelation\".\"test_relation_pk\" = \"TestEntity\".\"one_test_relation_id\""), plan.clauses());
  }

  @Test
  void compilingTwiceGivesTheSameText() {
    SortField[] sort = {SortField.asc("stringType").withNulls(NULLS_FIRST), SortField.desc("dateType")};
    assertEquals(compile(EMULATING, sort), compile(EMULATING, sort));
  }

  @Test
  void unknownSortFieldFails() {
    assertThrows(FieldResolutionException.class, () -> compile(new SqliteDialect(), SortField.asc("nope")));
  }
}
