package io.axis.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

  @Test
  void forwardedFor_firstHopWins() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-Forwarded-For", " 203.0.113.9 , 10.0.0.2");
    request.addHeader("X-Real-IP", "10.0.0.3");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("203.0.113.9");
  }

  @Test
  void realIp_whenNoForwardedFor() {
    var request = new MockHttpServletRequest();
    request.addHeader("X-Real-IP", "198.51.100.1");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("198.51.100.1");
  }

  @Test
  void remoteAddress_asLastResort() {
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("192.0.2.10");

    assertThat(ClientIpResolver.resolve(request)).isEqualTo("192.0.2.10");
    assertThat(ClientIpResolver.resolve(" ", null, "192.0.2.11")).isEqualTo("192.0.2.11");
  }
}
