package io.axis.backend.audit;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Request audit settings.
 *
 * @param apiPrefix only paths starting with this prefix are audited
 * @param auditedMethods HTTP methods that produce an action record
 * @param maxIpLength client IP values are truncated to this length
 * @param maxUserAgentLength user agent values are truncated to this length
 * @param sinkMode whether records are written on the request thread or handed to a bounded pool
 * @param asyncPoolSize worker threads for {@link SinkMode#ASYNC}
 * @param asyncQueueCapacity pending records before new ones are dropped in {@link SinkMode#ASYNC}
 */
@ConfigurationProperties(prefix = "axis.audit")
public record AuditProperties(
    @DefaultValue("/api/") String apiPrefix,
    @DefaultValue({"POST", "PUT", "PATCH", "DELETE"}) List<String> auditedMethods,
    @DefaultValue("45") int maxIpLength,
    @DefaultValue("500") int maxUserAgentLength,
    @DefaultValue("SYNC") SinkMode sinkMode,
    @DefaultValue("2") int asyncPoolSize,
    @DefaultValue("1000") int asyncQueueCapacity) {

  public enum SinkMode {
    SYNC,
    ASYNC
  }
}
