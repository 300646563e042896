package jobqueue.content;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

final class Payloads {

  private Payloads() {
  }

  static String requiredString(Map<String, Object> payload, String field) {
    String value = optionalString(payload, field);
    if (value == null || value.isBlank()) {
      throw new InvalidPayloadException(field + " is required");
    }
    return value;
  }

  static String optionalString(Map<String, Object> payload, String field) {
    Object value = payload.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String s)) {
      throw new InvalidPayloadException(field + " must be a string");
    }
    return s;
  }

  static List<String> stringList(Map<String, Object> payload, String field) {
    Object value = payload.get(field);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof Collection<?> items)) {
      throw new InvalidPayloadException(field + " must be an array of strings");
    }
    List<String> result = new ArrayList<>(items.size());
    for (Object item : items) {
      if (!(item instanceof String s)) {
        throw new InvalidPayloadException(field + " must be an array of strings");
      }
      result.add(s);
    }
    return result;
  }
}
