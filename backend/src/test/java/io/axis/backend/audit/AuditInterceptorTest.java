package io.axis.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.axis.backend.authorization.Actor;
import io.axis.backend.authorization.ActorRole;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
class AuditInterceptorTest {

  private static final Instant NOW = Instant.parse("2026-05-04T08:30:00Z");
  private static final Actor ACTOR = Actor.of("user_1", ActorRole.STAFF);

  @Mock private AuditSink sink;

  private AuditInterceptor interceptor;

  @AuditedEntity("Document")
  static class DocumentHandlers {
    public void update() {}
  }

  record UploadRequest(String title, String password) {}

  @BeforeEach
  void setUp() {
    var properties =
        new AuditProperties(
            "/api/",
            List.of("POST", "PUT", "PATCH", "DELETE"),
            45,
            500,
            AuditProperties.SinkMode.SYNC,
            2,
            1000);
    interceptor =
        new AuditInterceptor(
            properties,
            new EntityResolver(),
            new PayloadRedactor(),
            sink,
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private AuditedExchange exchange(
      String method,
      String path,
      Actor actor,
      Object parsedBody,
      byte[] rawBody,
      HttpHeaders headers,
      Map<String, List<String>> query)
      throws Exception {
    var bean = new DocumentHandlers();
    return new AuditedExchange(
        method,
        path,
        query,
        headers,
        "203.0.113.7",
        actor,
        new HandlerMethod(bean, DocumentHandlers.class.getMethod("update")),
        Map.of("id", "doc-42"),
        parsedBody,
        rawBody,
        200,
        12);
  }

  private ActionRecord captured() {
    var captor = ArgumentCaptor.forClass(ActionRecord.class);
    verify(sink).write(captor.capture());
    return captor.getValue();
  }

  @Test
  void shouldAudit_onlyStateChangingApiRequestsByAuthenticatedActors() {
    assertThat(interceptor.shouldAudit("POST", "/api/documents", ACTOR)).isTrue();
    assertThat(interceptor.shouldAudit("put", "/api/documents/1", ACTOR)).isTrue();
    assertThat(interceptor.shouldAudit("PATCH", "/api/documents/1", ACTOR)).isTrue();
    assertThat(interceptor.shouldAudit("DELETE", "/api/documents/1", ACTOR)).isTrue();

    assertThat(interceptor.shouldAudit("GET", "/api/documents", ACTOR)).isFalse();
    assertThat(interceptor.shouldAudit("OPTIONS", "/api/documents", ACTOR)).isFalse();
    assertThat(interceptor.shouldAudit("POST", "/actuator/health", ACTOR)).isFalse();
    assertThat(interceptor.shouldAudit("POST", "/api/documents", Actor.ANONYMOUS)).isFalse();
    assertThat(interceptor.shouldAudit("POST", "/api/documents", null)).isFalse();
  }

  @Test
  void intercept_get_writesNothing() throws Exception {
    interceptor.intercept(
        exchange("GET", "/api/documents/doc-42", ACTOR, null, new byte[0], null, Map.of()));

    verifyNoInteractions(sink);
  }

  @Test
  void intercept_put_capturesEntityActorAndEnvelope() throws Exception {
    var headers = new HttpHeaders();
    headers.add(HttpHeaders.USER_AGENT, "curl/8.0");
    headers.add("X-Client-ID", "c1");
    headers.add(HttpHeaders.CONTENT_TYPE, "application/json");

    interceptor.intercept(
        exchange(
            "PUT",
            "/api/documents/doc-42",
            ACTOR,
            new UploadRequest("Report", "hunter2"),
            new byte[0],
            headers,
            Map.of("access_token", List.of("abc"), "draft", List.of("true"))));

    var record = captured();
    assertThat(record.getActorId()).isEqualTo("user_1");
    assertThat(record.getAction()).isEqualTo(ActionKind.UPDATE);
    assertThat(record.getEntityType()).isEqualTo("Document");
    assertThat(record.getEntityId()).isEqualTo("doc-42");
    assertThat(record.getIpAddress()).isEqualTo("203.0.113.7");
    assertThat(record.getUserAgent()).isEqualTo("curl/8.0");
    assertThat(record.getCreatedAt()).isEqualTo(NOW);

    var envelope = record.getContext();
    assertThat(envelope.method()).isEqualTo("PUT");
    assertThat(envelope.path()).isEqualTo("/api/documents/doc-42");
    assertThat(envelope.statusCode()).isEqualTo(200);
    assertThat(envelope.durationMs()).isEqualTo(12);
    assertThat(envelope.tenantContext()).isEqualTo("c1");
    assertThat(envelope.requestData())
        .isEqualTo(Map.of("title", "Report", "password", PayloadRedactor.REDACTED));
    assertThat(envelope.queryParams())
        .containsEntry("access_token", PayloadRedactor.REDACTED)
        .containsEntry("draft", List.of("true"));
    assertThat(envelope.extensions())
        .isEqualTo(new AuditExtensions("DocumentHandlers#update", "application/json"));
  }

  @Test
  void intercept_fallsBackToRawJsonBody() throws Exception {
    byte[] raw = "{\"name\":\"n\",\"secret\":\"s\"}".getBytes(StandardCharsets.UTF_8);

    interceptor.intercept(exchange("POST", "/api/documents", ACTOR, null, raw, null, Map.of()));

    var record = captured();
    assertThat(record.getAction()).isEqualTo(ActionKind.CREATE);
    assertThat(record.getContext().requestData())
        .isEqualTo(Map.of("name", "n", "secret", PayloadRedactor.REDACTED));
  }

  @Test
  void intercept_unparseableBody_isRecordedAsEmptyMap() throws Exception {
    byte[] raw = "name=n&x=1".getBytes(StandardCharsets.UTF_8);

    interceptor.intercept(exchange("DELETE", "/api/documents/1", ACTOR, null, raw, null, null));

    var record = captured();
    assertThat(record.getAction()).isEqualTo(ActionKind.DELETE);
    assertThat(record.getContext().requestData()).isEqualTo(Map.of());
  }

  @Test
  void intercept_tenantContextFromQueryParameter() throws Exception {
    interceptor.intercept(
        exchange(
            "PATCH",
            "/api/documents/1",
            ACTOR,
            null,
            null,
            null,
            Map.of("client_id", List.of("c7"))));

    assertThat(captured().getContext().tenantContext()).isEqualTo("c7");
  }

  @Test
  void intercept_truncatesIpAndUserAgent() throws Exception {
    var headers = new HttpHeaders();
    headers.add(HttpHeaders.USER_AGENT, "u".repeat(800));
    var base = exchange("POST", "/api/documents", ACTOR, null, null, headers, Map.of());
    var longIp =
        new AuditedExchange(
            base.method(),
            base.path(),
            base.queryParams(),
            base.headers(),
            "a".repeat(60),
            base.actor(),
            base.handler(),
            base.uriVariables(),
            null,
            null,
            201,
            3);

    interceptor.intercept(longIp);

    var record = captured();
    assertThat(record.getIpAddress()).hasSize(45);
    assertThat(record.getUserAgent()).hasSize(500);
    assertThat(record.getContext().clientIp()).hasSize(45);
    assertThat(record.getContext().statusCode()).isEqualTo(201);
  }

  @Test
  void intercept_sinkFailure_isSwallowed() throws Exception {
    doThrow(new IllegalStateException("database down")).when(sink).write(any());

    assertThatCode(
            () ->
                interceptor.intercept(
                    exchange("POST", "/api/documents", ACTOR, null, null, null, Map.of())))
        .doesNotThrowAnyException();
  }
}
