package io.intellixity.relq.sql.compile;

import io.intellixity.relq.metadata.*;
import io.intellixity.relq.sql.dialect.SqliteDialect;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.intellixity.relq.query.QueryFilters.and;
import static io.intellixity.relq.query.QueryFilters.eq;
import static io.intellixity.relq.sql.fixtures.TestEntities.*;
import static org.junit.jupiter.api.Assertions.*;

final class JoinResolverTest {
  private final MetadataRegistry registry = registry();
  private final JoinResolver joins = new JoinResolver(registry, new SqliteDialect());

  private static Scope root() {
    return Scope.root("TestEntity", TEST_ENTITY_METADATA);
  }

  private JoinPlan resolve(String relation) {
    JoinPlan plan = new JoinPlan("TestEntity");
    joins.resolve(root(), relation, plan, JoinType.LEFT);
    return plan;
  }

  @Test
  void oneToManyJoinsOnTheTargetForeignKey() {
    assertEquals(List.of("LEFT JOIN \"test_relation\" \"TestEntity_testRelations\"" +
        " ON \"TestEntity_testRelations\".\"test_entity_id\" = \"TestEntity\".\"test_entity_pk\""),
        resolve("testRelations").clauses());
  }

  @Test
  void manyToOneJoinsOnTheOwnerForeignKey() {
    assertEquals(List.of("LEFT JOIN \"test_relation\" \"TestEntity_manyToOneRelation\"" +
        " ON \"TestEntity_manyToOneRelation\".\"test_relation_pk\" = \"TestEntity\".\"many_to_one_relation_id\""),
        resolve("manyToOneRelation").clauses());
  }

  @Test
  void owningOneToOneJoinsOnTheOwnerForeignKey() {
    assertEquals(List.of("LEFT JOIN \"test_relation\" \"TestEntity_oneTestRelation\"" +
        " ON \"TestEntity_oneTestRelation\".\"test_relation_pk\" = \"TestEntity\".\"one_test_relation_id\""),
        resolve("oneTestRelation").clauses());
  }

  @Test
  void inverseOneToOneTakesTheColumnFromTheOwningSide() {
    JoinPlan plan = new JoinPlan("TestRelation");
    joins.resolve(Scope.root("TestRelation", TEST_RELATION_METADATA), "oneTestEntity", plan, JoinType.INNER);
    assertEquals(List.of("INNER JOIN \"test_entity\" \"TestRelation_oneTestEntity\"" +
        " ON \"TestRelation_oneTestEntity\".\"one_test_relation_id\" = \"TestRelation\".\"test_relation_pk\""),
        plan.clauses());
  }

  @Test
  void manyToManyJoinsThroughTheJunction() {
    JoinPlan plan = resolve("manyTestRelations");
    assertEquals(List.of(
        "LEFT JOIN \"test_entity_many_test_relations_test_relation\" \"TestEntity_manyTestRelations_jt\"" +
            " ON \"TestEntity_manyTestRelations_jt\".\"test_entity_id\" = \"TestEntity\".\"test_entity_pk\"",
        "LEFT JOIN \"test_relation\" \"TestEntity_manyTestRelations\"" +
            " ON \"TestEntity_manyTestRelations\".\"test_relation_pk\" = \"TestEntity_manyTestRelations_jt\".\"test_relation_id\""),
        plan.clauses());
    assertEquals(1, plan.size());
  }

  @Test
  void inverseManyToManyFlipsTheJunction() {
    JoinKeys keys = joins.keysFor(TEST_RELATION_METADATA, registry.relation("TestRelation", "manyTestEntities"));
    assertEquals(new JoinKeys.Junction("test_entity_many_test_relations_test_relation",
        "test_relation_id", "test_relation_pk", "test_entity_id", "test_entity_pk"), keys);
  }

  @Test
  void explicitReferencedColumnsAreKept() {
    JoinKeys keys = joins.keysFor(TEST_ENTITY_METADATA, registry.relation("TestEntity", "testEntityRelation"));
    assertEquals(new JoinKeys.Junction("test_entity_relation_entity",
        "test_entity_id", "test_entity_pk", "test_relation_id", "test_relation_pk"), keys);
  }

  @Test
  void samePathIsJoinedOnce() {
    JoinPlan plan = new JoinPlan("TestEntity");
    Scope first = joins.resolve(root(), "testRelations", plan, JoinType.LEFT);
    Scope second = joins.resolve(root(), "testRelations", plan, JoinType.LEFT);
    assertSame(first, second);
    assertEquals(1, plan.clauses().size());
  }

  @Test
  void pathAliasesAreUnique() {
    JoinPlan plan = new JoinPlan("TestEntity");
    Scope a = joins.resolvePath(root(), List.of("manyToOneRelation", "testEntity"), plan, JoinType.LEFT);
    Scope b = joins.resolvePath(root(), List.of("oneTestRelation", "testEntity"), plan, JoinType.LEFT);
    Scope c = joins.resolvePath(root(), List.of("manyTestRelations", "manyTestEntities"), plan, JoinType.LEFT);

    assertEquals("TestEntity_manyToOneRelation_testEntity", a.alias());
    assertEquals("TestEntity_oneTestRelation_testEntity", b.alias());
    assertEquals(List.of("manyTestRelations", "manyTestEntities"), c.path());
    assertEquals(6, plan.size());

    assertDistinctAliases(plan);
  }

  @Test
  void takenAliasGetsANumericSuffix() {
    JoinPlan plan = new JoinPlan("TestEntity");
    assertEquals("x", plan.allocate("x"));
    assertEquals("x_2", plan.allocate("x"));
    assertEquals("x_3", plan.allocate("x"));
    assertEquals("TestEntity_2", plan.allocate("TestEntity"));
  }

  @Test
  void underscoreInRelationNameDoesNotClashWithPath() {
    EntityMetadata a = EntityMetadata.builder("A", "a").id("id", "id")
        .column("bId", "b_id")
        .column("bcId", "b_c_id")
        .relation("b", "B", RelationKind.manyToOne("b_id"))
        .relation("b_c", "B", RelationKind.manyToOne("b_c_id"))
        .build();
    EntityMetadata b = EntityMetadata.builder("B", "b").id("id", "id")
        .column("name", "name")
        .column("cId", "c_id")
        .relation("c", "B", RelationKind.manyToOne("c_id"))
        .build();
    Compilers compilers = Compilers.of(new InMemoryMetadataRegistry(a, b), new SqliteDialect());
    JoinPlan plan = new JoinPlan("A");

    String sql = compilers.filters().compile(
        and(
            eq("b.c.name", "x"),
            eq("b_c.name", "y")),
        Scope.root("A", a), plan, new Params(new SqliteDialect()));

    assertEquals("(\"A_b_c\".\"name\" = ?) AND (\"A_b_c_2\".\"name\" = ?)", sql);
    assertEquals(List.of(
        "LEFT JOIN \"b\" \"A_b\" ON \"A_b\".\"id\" = \"A\".\"b_id\"",
        "LEFT JOIN \"b\" \"A_b_c\" ON \"A_b_c\".\"id\" = \"A_b\".\"c_id\"",
        "LEFT JOIN \"b\" \"A_b_c_2\" ON \"A_b_c_2\".\"id\" = \"A\".\"b_c_id\""), plan.clauses());
    assertDistinctAliases(plan);
  }

  @Test
  void relationNamedLikeACorrelationSuffixGetsItsOwnAlias() {
    EntityMetadata a = EntityMetadata.builder("A", "a").id("id", "id")
        .column("userId", "user_id")
        .relation("user", "U", RelationKind.manyToOne("user_id"))
        .relation("tags", "U", RelationKind.manyToMany(JoinTableSpec.of("a_tag", "a_id", "u_id")))
        .build();
    EntityMetadata u = EntityMetadata.builder("U", "u").id("id", "id")
        .column("name", "name")
        .column("ownerId", "owner_id")
        .relation("owner", "U", RelationKind.manyToOne("owner_id"))
        .relation("jt", "U", RelationKind.manyToOne("owner_id"))
        .build();
    JoinResolver resolver = new JoinResolver(new InMemoryMetadataRegistry(a, u), new SqliteDialect());

    JoinPlan owned = new JoinPlan("user");
    Scope userRoot = Scope.root("user", u);
    resolver.correlate(userRoot, a, a.relation("user"), owned);
    assertEquals("user_owner_2", resolver.resolve(userRoot, "owner", owned, JoinType.LEFT).alias());
    assertDistinctAliases(owned);

    JoinPlan tagged = new JoinPlan("tags");
    Scope tagRoot = Scope.root("tags", u);
    resolver.correlate(tagRoot, a, a.relation("tags"), tagged);
    assertEquals("tags_jt_2", resolver.resolve(tagRoot, "jt", tagged, JoinType.LEFT).alias());
    assertDistinctAliases(tagged);
  }

  private static void assertDistinctAliases(JoinPlan plan) {
    Set<String> aliases = new HashSet<>();
    aliases.add(plan.rootAlias());
    for (String clause : plan.clauses()) {
      String alias = clause.split(" ")[3];
      assertTrue(aliases.add(alias), "duplicate alias " + alias + " in " + plan.clauses());
    }
  }

  @Test
  void nonOwningSideWithoutInverseFails() {
    EntityMetadata a = EntityMetadata.builder("A", "a").id("id", "id")
        .relation("bs", "B", RelationKind.oneToMany())
        .build();
    EntityMetadata b = EntityMetadata.builder("B", "b").id("id", "id").build();
    JoinResolver resolver = new JoinResolver(new InMemoryMetadataRegistry(a, b), new SqliteDialect());
    assertThrows(IllegalStateException.class, () -> resolver.keysFor(a, a.relation("bs")));
  }

  @Test
  void inverseOfTheWrongKindFails() {
    EntityMetadata a = EntityMetadata.builder("A", "a").id("id", "id")
        .relation("bs", "B", RelationKind.oneToMany(), "as")
        .build();
    EntityMetadata b = EntityMetadata.builder("B", "b").id("id", "id")
        .relation("as", "A", RelationKind.oneToMany(), "bs")
        .build();
    JoinResolver resolver = new JoinResolver(new InMemoryMetadataRegistry(a, b), new SqliteDialect());
    assertThrows(IllegalStateException.class, () -> resolver.keysFor(a, a.relation("bs")));
  }
}
