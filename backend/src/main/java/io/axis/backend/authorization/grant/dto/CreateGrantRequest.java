package io.axis.backend.authorization.grant.dto;

import io.axis.backend.authorization.ActorRole;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateGrantRequest(
    @NotBlank(message = "actorId is required") @Size(max = 255) String actorId,
    @NotBlank(message = "tenantId is required") @Size(max = 255) String tenantId,
    /** Role held within the tenant. Manager-level roles may modify objects they do not own. */
    @Nullable ActorRole grantRole,
    @Nullable @Size(max = 2000, message = "notes must not exceed 2000 characters") String notes) {}
