package io.axis.backend.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.axis.backend.authorization.Actor;
import io.axis.backend.authorization.ActorRole;
import io.axis.backend.security.ActorResolver;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class RequestLoggingFilterTest {

  @Mock private ActorResolver actorResolver;

  @Test
  void populatesMdcDuringRequest_andClearsAfterwards() throws Exception {
    when(actorResolver.currentActor()).thenReturn(Actor.of("user_3", ActorRole.STAFF));
    var filter = new RequestLoggingFilter(actorResolver);
    var request = new MockHttpServletRequest("GET", "/api/tenant-grants");
    request.setAttribute(TenantContextFilter.TENANT_CONTEXT_ATTRIBUTE, "client-a");
    Map<String, String> seen = new HashMap<>();

    filter.doFilterInternal(
        request,
        new MockHttpServletResponse(),
        (req, res) -> seen.putAll(MDC.getCopyOfContextMap()));

    assertThat(seen)
        .containsEntry(RequestLoggingFilter.MDC_ACTOR_ID, "user_3")
        .containsEntry(RequestLoggingFilter.MDC_CLIENT_ID, "client-a")
        .containsKey(RequestLoggingFilter.MDC_REQUEST_ID);
    assertThat(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID)).isNull();
    assertThat(MDC.get(RequestLoggingFilter.MDC_ACTOR_ID)).isNull();
    assertThat(MDC.get(RequestLoggingFilter.MDC_CLIENT_ID)).isNull();
  }

  @Test
  void anonymousCaller_hasNoActorInMdc() throws Exception {
    when(actorResolver.currentActor()).thenReturn(Actor.ANONYMOUS);
    var filter = new RequestLoggingFilter(actorResolver);
    Map<String, String> seen = new HashMap<>();

    filter.doFilterInternal(
        new MockHttpServletRequest("GET", "/api/tenant-grants"),
        new MockHttpServletResponse(),
        (req, res) -> seen.putAll(MDC.getCopyOfContextMap()));

    assertThat(seen).doesNotContainKey(RequestLoggingFilter.MDC_ACTOR_ID);
  }
}
