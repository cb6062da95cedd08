package io.axis.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayloadRedactorTest {

  private final PayloadRedactor redactor = new PayloadRedactor();

  @Test
  void redact_masksSensitiveKeysAtEveryDepth() {
    var payload = Map.of("password", "x", "profile", Map.of("token", "y", "name", "n"));

    var redacted = redactor.redact(payload);

    assertThat(redacted)
        .isEqualTo(
            Map.of(
                "password",
                PayloadRedactor.REDACTED,
                "profile",
                Map.of("token", PayloadRedactor.REDACTED, "name", "n")));
  }

  @Test
  void redact_isIdempotent() {
    var payload = Map.of("password", "x", "profile", Map.of("token", "y", "name", "n"));

    var once = redactor.redact(payload);

    assertThat(redactor.redact(once)).isEqualTo(once);
  }

  @Test
  void redact_matchesBySubstring_caseInsensitively() {
    var payload = new HashMap<String, Object>();
    payload.put("X-Api_Key", "k");
    payload.put("userPassword", "p");
    payload.put("Authorization", "Bearer abc");
    payload.put("author", "Jane");
    payload.put("cardNumberHint", "1234");
    payload.put("title", "Quarterly report");

    @SuppressWarnings("unchecked")
    var redacted = (Map<String, Object>) redactor.redact(payload);

    assertThat(redacted)
        .containsEntry("X-Api_Key", PayloadRedactor.REDACTED)
        .containsEntry("userPassword", PayloadRedactor.REDACTED)
        .containsEntry("Authorization", PayloadRedactor.REDACTED)
        .containsEntry("author", PayloadRedactor.REDACTED)
        .containsEntry("cardNumberHint", "1234")
        .containsEntry("title", "Quarterly report");
  }

  @Test
  void redact_handlesMapsInsideLists() {
    var payload =
        Map.of(
            "contacts",
            List.of(Map.of("email", "a@example.com", "pin", "0000"), "plain", 42),
            "items",
            List.of(Map.of("secret_note", "s")));

    var redacted = redactor.redact(payload);

    assertThat(redacted)
        .isEqualTo(
            Map.of(
                "contacts",
                List.of(
                    Map.of("email", "a@example.com", "pin", PayloadRedactor.REDACTED),
                    "plain",
                    42),
                "items",
                List.of(Map.of("secret_note", PayloadRedactor.REDACTED))));
  }

  @Test
  void redact_topLevelListsAndScalars() {
    assertThat(redactor.redact(List.of(Map.of("token", "t"))))
        .isEqualTo(List.of(Map.of("token", PayloadRedactor.REDACTED)));
    assertThat(redactor.redact("plain text")).isEqualTo("plain text");
    assertThat(redactor.redact(null)).isNull();
  }

  @Test
  void redact_doesNotModifyInput() {
    var nested = new HashMap<String, Object>();
    nested.put("token", "y");
    var payload = new HashMap<String, Object>();
    payload.put("password", "x");
    payload.put("profile", nested);

    redactor.redact(payload);

    assertThat(payload).containsEntry("password", "x");
    assertThat(nested).containsEntry("token", "y");
  }

  @Test
  void redact_nullKeysAndValuesAreTolerated() {
    var payload = new HashMap<String, Object>();
    payload.put(null, "value");
    payload.put("name", null);

    @SuppressWarnings("unchecked")
    var redacted = (Map<String, Object>) redactor.redact(payload);

    assertThat(redacted).containsEntry("null", "value").containsEntry("name", null);
  }
}
