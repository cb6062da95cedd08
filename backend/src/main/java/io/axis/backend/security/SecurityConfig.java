package io.axis.backend.security;

import io.axis.backend.audit.AuditAuthenticationEntryPoint;
import io.axis.backend.audit.AuditFilter;
import io.axis.backend.multitenancy.RequestLoggingFilter;
import io.axis.backend.multitenancy.TenantContextFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.StaticHeadersWriter;

/**
 * Stateless bearer-token security for {@code /api/**}. Filter order after authentication: request
 * auditing first, so tenant rejections are recorded too, then tenant context validation, then MDC
 * binding.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  static final String CONTENT_SECURITY_POLICY =
      "default-src 'none'; script-src 'none'; style-src 'none'; img-src 'none'; font-src 'none';"
          + " connect-src 'self'; frame-ancestors 'none'; base-uri 'self'; form-action 'self'";

  static final String PERMISSIONS_POLICY =
      "accelerometer=(), camera=(), geolocation=(), gyroscope=(), magnetometer=(),"
          + " microphone=(), payment=(), usb=()";

  private final ActorJwtAuthenticationConverter jwtAuthConverter;
  private final TenantContextFilter tenantContextFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final AuditFilter auditFilter;
  private final AuditAuthenticationEntryPoint auditAuthEntryPoint;

  public SecurityConfig(
      ActorJwtAuthenticationConverter jwtAuthConverter,
      TenantContextFilter tenantContextFilter,
      RequestLoggingFilter requestLoggingFilter,
      AuditFilter auditFilter,
      AuditAuthenticationEntryPoint auditAuthEntryPoint) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.tenantContextFilter = tenantContextFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.auditFilter = auditFilter;
    this.auditAuthEntryPoint = auditAuthEntryPoint;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .headers(
            headers ->
                headers
                    .contentSecurityPolicy(csp -> csp.policyDirectives(CONTENT_SECURITY_POLICY))
                    .referrerPolicy(
                        referrer -> referrer.policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
                    .frameOptions(frame -> frame.deny())
                    .addHeaderWriter(
                        new StaticHeadersWriter("Permissions-Policy", PERMISSIONS_POLICY)))
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(auditAuthEntryPoint))
        .addFilterAfter(auditFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantContextFilter, AuditFilter.class)
        .addFilterAfter(requestLoggingFilter, TenantContextFilter.class);

    return http.build();
  }
}
