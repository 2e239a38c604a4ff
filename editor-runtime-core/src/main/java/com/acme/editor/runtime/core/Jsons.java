package com.acme.editor.runtime.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

/** Jackson helpers shared by the event log, snapshot store and tooling. */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + describe(o), e);
    }
  }

  public static String toPrettyJson(Object o) {
    try {
      return M.writerWithDefaultPrettyPrinter().writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + describe(o), e);
    }
  }

  /** Converts any payload into a detached JSON tree. {@code null} becomes a JSON null node. */
  public static JsonNode toTree(Object o) {
    if (o == null) {
      return NullNode.getInstance();
    }
    if (o instanceof JsonNode node) {
      return node.deepCopy();
    }
    try {
      return M.valueToTree(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot convert " + describe(o) + " to JSON", e);
    }
  }

  public static <T> T fromTree(JsonNode node, Class<T> clazz) {
    try {
      return M.treeToValue(node, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot read JSON as " + clazz.getSimpleName(), e);
    }
  }

  /**
   * Deep copy through a Jackson round trip. The value's runtime class must be readable by
   * Jackson (records, beans, collections, maps).
   */
  @SuppressWarnings("unchecked")
  public static <T> T deepCopy(T value) {
    if (value == null) {
      return null;
    }
    if (value instanceof JsonNode node) {
      return (T) node.deepCopy();
    }
    Class<T> type = (Class<T>) value.getClass();
    try {
      return M.treeToValue(M.valueToTree(value), type);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot copy " + describe(value), e);
    }
  }

  /** Convert an object to a Map&lt;String, Object&gt; by serializing through Jackson. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> toMap(Object o) {
    try {
      return M.convertValue(o, Map.class);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot convert " + describe(o) + " to a map", e);
    }
  }

  private static String describe(Object o) {
    return o == null ? "null" : o.getClass().getSimpleName();
  }
}
