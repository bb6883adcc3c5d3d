package io.intellixity.relq.sql.compile;

import io.intellixity.relq.metadata.MetadataRegistry;
import io.intellixity.relq.sql.dialect.SqlDialect;

/** The compilers for one registry and dialect, wired together. Stateless and shareable. */
public record Compilers(JoinResolver joins, FieldResolver fields, FilterCompiler filters,
                        SortCompiler sorts, PagingCompiler paging) {

  public static Compilers of(MetadataRegistry registry, SqlDialect dialect) {
    JoinResolver joins = new JoinResolver(registry, dialect);
    FieldResolver fields = new FieldResolver(joins, dialect);
    return new Compilers(joins, fields, new FilterCompiler(fields, dialect), new SortCompiler(fields, dialect),
        new PagingCompiler(dialect));
  }
}
