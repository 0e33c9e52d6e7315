package notestore.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import notestore.ValidationException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Mapper used by the default codec. Exposed so callers can derive a customized copy.
   */
  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();
  }

  @Override
  public JsonNode toTree(Object value) {
    return mapper.valueToTree(value);
  }

  @Override
  public ObjectNode toObject(Object value) {
    JsonNode node = toTree(value);
    if (!(node instanceof ObjectNode object)) {
      throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
    }
    return object;
  }

  @Override
  public <T> T fromTree(JsonNode node, Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (JsonProcessingException e) {
      throw invalid(e);
    } catch (IllegalArgumentException e) {
      throw invalid(e.getCause() instanceof JsonProcessingException jpe ? jpe : null, e);
    }
  }

  @Override
  public <T> T convert(Object value, TypeReference<T> type) {
    try {
      return mapper.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw invalid(e.getCause() instanceof JsonProcessingException jpe ? jpe : null, e);
    }
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize " + value.getClass().getName(), e);
    }
  }

  @Override
  public JsonNode parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw invalid(e);
    }
  }

  private static ValidationException invalid(JsonProcessingException e) {
    return invalid(e, e);
  }

  private static ValidationException invalid(JsonProcessingException mapping, Exception source) {
    String path = "";
    String message = source.getMessage();
    if (mapping instanceof JsonMappingException jme) {
      path = jme.getPath().stream()
          .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
          .collect(Collectors.joining("."))
          .replace(".[", "[");
      message = jme.getOriginalMessage();
    } else if (mapping != null) {
      message = mapping.getOriginalMessage();
    }
    return new ValidationException(path, message == null ? "malformed value" : message);
  }
}
