package jobqueue.util;

import java.util.Map;

/**
 * Codec for job payloads and results to and from JSON objects.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) uses a shared Jackson
 * {@code ObjectMapper}. Applications that already configure their own mapper (e.g. Spring
 * Boot) can pass it to {@link JacksonJsonCodec#JacksonJsonCodec(com.fasterxml.jackson.databind.ObjectMapper)}.
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
   * Encodes a value as JSON. {@code null} encodes as an empty object.
   *
   * @param value a map, record, bean, or other Jackson-serializable value
   * @return the JSON string
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Parses a JSON object string into a map. Returns an empty map for {@code null},
   * empty, or {@code "null"} input.
   *
   * @param json the JSON string to parse
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, Object> parseObject(String json);
}
