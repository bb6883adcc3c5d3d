package io.intellixity.relq.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Query}.
 * <p>
 * Structural decoding only: field names are checked later, against entity metadata, by the compiler.
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    return parseQuery(root, codec);
  }

  private static Query parseQuery(JsonNode root, ObjectCodec codec) throws IOException {
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    Query q = new Query();

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q = q.withFilter(parseElement(filter, codec));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        if (f == null) continue;
        String dir = textOrNull(s.get("dir"));
        if (dir == null) dir = textOrNull(s.get("direction"));
        String nulls = textOrNull(s.get("nulls"));
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        SortField.Nulls n = (nulls == null) ? null : SortField.Nulls.valueOf(nulls.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d, n));
      }
      q = q.withSort(fields);
    }

    JsonNode page = root.get("page");
    if (page == null) page = root.get("paging");
    if (page != null && page.isObject()) {
      q = q.withPage(new Paging(intOrNull(page, "limit"), intOrNull(page, "offset")));
    }

    JsonNode relations = root.get("relations");
    if (relations != null && relations.isArray()) {
      List<RelationQuery> out = new ArrayList<>();
      for (JsonNode r : relations) {
        String name = textOrNull(r.get("name"));
        if (name == null) throw new IllegalArgumentException("Relation query requires name");
        out.add(new RelationQuery(name, parseQuery(r.get("query"), codec)));
      }
      q = q.withRelations(out);
    }

    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // { "not": <element> }
    if (n.has("not")) {
      QueryElement child = parseElement(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    // { "relation": { "name": "...", "filter": <element> } }
    if (n.has("relation")) {
      JsonNode body = n.get("relation");
      String name = textOrNull(body.get("name"));
      if (name == null) throw new IllegalArgumentException("relation filter requires name");
      QueryElement nested = parseElement(body.get("filter"), codec);
      if (nested == null) throw new IllegalArgumentException("relation filter '" + name + "' requires filter");
      return new RelationFilter(name, nested);
    }

    // { "eq": { "field": ..., "value": ..., "not"?: ... } }
    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = Operator.fromKey(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return parseCondition(op, body, codec);
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op.key() + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    return switch (op.arity()) {
      case RANGE -> {
        JsonNode values = body.get("values");
        if (values != null && values.isArray()) {
          if (values.size() != 2) {
            throw new InvalidFilterException(op.key() + " on '" + field + "' requires exactly two values, got " + values.size());
          }
          yield new Condition(field, op, null, decodeValue(values.get(0), codec), decodeValue(values.get(1), codec), not);
        }
        yield new Condition(field, op, null, decodeValue(body.get("lower"), codec), decodeValue(body.get("upper"), codec), not);
      }
      case LIST -> new Condition(field, op, decodeValue(body.get("values"), codec), null, null, not);
      case NONE -> new Condition(field, op, null, null, null, not);
      case SINGLE -> new Condition(field, op, decodeValue(body.get("value"), codec), null, null, not);
    };
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode page, String name) {
    JsonNode n = page.get(name);
    if (n == null || n.isNull()) return null;
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
    if (n.isNumber()) throw new InvalidPagingException(name + " must be an integer, got " + n.asText());
    try {
      return Integer.parseInt(n.asText().trim());
    } catch (NumberFormatException e) {
      throw new InvalidPagingException(name + " must be an integer, got '" + n.asText() + "'", e);
    }
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
