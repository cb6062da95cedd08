package io.axis.backend.authorization.grant;

import io.axis.backend.audit.AuditedEntity;
import io.axis.backend.authorization.ObjectAccessGuard;
import io.axis.backend.authorization.grant.dto.CreateGrantRequest;
import io.axis.backend.authorization.grant.dto.GrantResponse;
import io.axis.backend.exception.InvalidRequestException;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant-grants")
@AuditedEntity("TenantAuthorizationGrant")
public class TenantGrantController {

  private final TenantGrantService grantService;
  private final ObjectAccessGuard accessGuard;

  public TenantGrantController(TenantGrantService grantService, ObjectAccessGuard accessGuard) {
    this.grantService = grantService;
    this.accessGuard = accessGuard;
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERUSER')")
  public ResponseEntity<GrantResponse> createGrant(
      @Valid @RequestBody CreateGrantRequest request) {
    var grant =
        grantService.grant(
            request.actorId(), request.tenantId(), request.grantRole(), request.notes());
    var response = GrantResponse.from(grant);
    return ResponseEntity.created(URI.create("/api/tenant-grants/" + response.id()))
        .body(response);
  }

  @GetMapping("/{id}")
  public ResponseEntity<GrantResponse> getGrant(@PathVariable UUID id) {
    var grant = accessGuard.requireRead(grantService.findById(id));
    return ResponseEntity.ok(GrantResponse.from(grant));
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MANAGER', 'ADMIN', 'SUPERUSER')")
  public ResponseEntity<List<GrantResponse>> listGrants(
      @RequestParam(required = false) String actorId,
      @RequestParam(required = false) String tenantId) {
    List<TenantAuthorizationGrant> grants;
    if (actorId != null && !actorId.isBlank()) {
      grants = grantService.activeGrantsForActor(actorId);
    } else if (tenantId != null && !tenantId.isBlank()) {
      grants = grantService.activeGrantsForTenant(tenantId);
    } else {
      throw InvalidRequestException.missingFilter("actorId", "tenantId");
    }
    return ResponseEntity.ok(grants.stream().map(GrantResponse::from).toList());
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERUSER')")
  public ResponseEntity<Void> revokeGrant(@PathVariable UUID id) {
    grantService.revoke(id);
    return ResponseEntity.noContent().build();
  }
}
