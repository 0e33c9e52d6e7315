package notestore.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Conversion between entity records, JSON trees and JSON text.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) writes instants as ISO-8601
 * strings, omits null fields and ignores unknown properties on read. Conversion failures
 * caused by the input are reported as {@link notestore.ValidationException}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Converts a value to a JSON tree.
   */
  JsonNode toTree(Object value);

  /**
   * Converts a record (or map) to a JSON object.
   *
   * @throws IllegalArgumentException if the value does not serialize to an object
   */
  ObjectNode toObject(Object value);

  /**
   * Binds a JSON tree to the given type.
   *
   * @throws notestore.ValidationException if the tree does not fit the type
   */
  <T> T fromTree(JsonNode node, Class<T> type);

  /**
   * Converts an arbitrary value to the given generic type.
   *
   * @throws notestore.ValidationException if the value does not fit the type
   */
  <T> T convert(Object value, TypeReference<T> type);

  String toJson(Object value);

  /**
   * Parses JSON text into a tree.
   *
   * @throws notestore.ValidationException if the text is not valid JSON
   */
  JsonNode parse(String json);

  /**
   * Parses JSON text and binds it to the given type.
   *
   * @throws notestore.ValidationException if the text is not valid JSON or does not fit
   */
  default <T> T read(String json, Class<T> type) {
    return fromTree(parse(json), type);
  }
}
