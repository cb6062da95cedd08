package io.axis.backend.audit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Masks sensitive values in captured request payloads before they are persisted. A map entry is
 * masked when its key, lower-cased, contains any deny-listed term; matching is by substring, so
 * {@code "author"} is masked too. Nested maps and maps inside lists are processed recursively.
 *
 * <p>The input is never modified. Redacting an already redacted payload returns an equal payload.
 */
@Component
public class PayloadRedactor {

  public static final String REDACTED = "[REDACTED]";

  static final List<String> SENSITIVE_TERMS =
      List.of(
          "password",
          "token",
          "secret",
          "api_key",
          "apikey",
          "access_token",
          "refresh_token",
          "auth",
          "authorization",
          "ssn",
          "social_security",
          "credit_card",
          "card_number",
          "cvv",
          "pin");

  public Object redact(Object payload) {
    if (payload instanceof Map<?, ?> map) {
      return redactMap(map);
    }
    if (payload instanceof List<?> list) {
      return redactList(list);
    }
    return payload;
  }

  public boolean isSensitive(Object key) {
    if (key == null) {
      return false;
    }
    String normalized = key.toString().toLowerCase(Locale.ROOT);
    for (String term : SENSITIVE_TERMS) {
      if (normalized.contains(term)) {
        return true;
      }
    }
    return false;
  }

  private Map<String, Object> redactMap(Map<?, ?> map) {
    var result = new LinkedHashMap<String, Object>();
    for (var entry : map.entrySet()) {
      String key = String.valueOf(entry.getKey());
      if (isSensitive(key)) {
        result.put(key, REDACTED);
      } else if (entry.getValue() instanceof Map<?, ?> nested) {
        result.put(key, redactMap(nested));
      } else if (entry.getValue() instanceof List<?> list) {
        result.put(key, redactList(list));
      } else {
        result.put(key, entry.getValue());
      }
    }
    return result;
  }

  private List<Object> redactList(List<?> list) {
    var result = new ArrayList<Object>(list.size());
    for (Object item : list) {
      result.add(item instanceof Map<?, ?> map ? redactMap(map) : item);
    }
    return result;
  }
}
