package io.intellixity.relq.pojo;

import java.util.Map;

/** Read-side accessor used to pull key values out of entity instances. */
public interface PojoAccessor<T> {
  /** Get a top-level field by name; null when the instance has no value for it. */
  Object get(T pojo, String field);

  /** Accessor for entities carried as field-name keyed maps. */
  static PojoAccessor<Map<String, ?>> forMaps() {
    return Map::get;
  }
}
