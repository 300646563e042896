package jobqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public JacksonJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return "{}";
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + value.getClass().getName() + " as JSON", e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return new LinkedHashMap<>();
    }
    try {
      JsonNode node = objectMapper.readTree(json);
      if (node == null || node.isNull()) {
        return new LinkedHashMap<>();
      }
      if (!node.isObject()) {
        throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
      }
      return objectMapper.convertValue(node, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON object", e);
    }
  }
}
