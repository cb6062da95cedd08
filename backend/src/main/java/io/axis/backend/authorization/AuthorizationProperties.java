package io.axis.backend.authorization;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Authorization settings.
 *
 * @param scopelessPolicy what to do when a non-elevated actor reads an object with no resolvable
 *     tenant scope
 */
@ConfigurationProperties(prefix = "axis.authorization")
public record AuthorizationProperties(@DefaultValue("ALLOW") ScopelessPolicy scopelessPolicy) {}
