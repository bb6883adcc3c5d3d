package io.intellixity.relq.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (!q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        if (sf.nulls() != null) g.writeStringField("nulls", sf.nulls().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    Paging page = q.page();
    if (page != null) {
      g.writeObjectFieldStart("page");
      if (page.limit() != null) g.writeNumberField("limit", page.limit());
      if (page.offset() != null) g.writeNumberField("offset", page.offset());
      g.writeEndObject();
    }

    if (!q.relations().isEmpty()) {
      g.writeArrayFieldStart("relations");
      for (RelationQuery rq : q.relations()) {
        g.writeStartObject();
        g.writeStringField("name", rq.name());
        g.writeFieldName("query");
        serialize(rq.query(), g, serializers);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof RelationFilter rf) {
      g.writeStartObject();
      g.writeObjectFieldStart("relation");
      g.writeStringField("name", rf.relation());
      g.writeFieldName("filter");
      writeElement(rf.filter(), g, serializers);
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().key());
      g.writeStringField("field", c.property());
      if (c.not()) g.writeBooleanField("not", true);
      switch (c.operator().arity()) {
        case RANGE -> {
          g.writeFieldName("lower");
          serializers.defaultSerializeValue(c.lower(), g);
          g.writeFieldName("upper");
          serializers.defaultSerializeValue(c.upper(), g);
        }
        case LIST -> {
          g.writeFieldName("values");
          serializers.defaultSerializeValue(c.value(), g);
        }
        case SINGLE -> {
          g.writeFieldName("value");
          serializers.defaultSerializeValue(c.value(), g);
        }
        case NONE -> { }
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }
}
