package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.server.auth.AdminPrincipal;
import com.codeheadsystems.pairing.server.auth.AuthenticatedPrincipal;
import com.codeheadsystems.pairing.server.auth.ClientPrincipal;
import com.codeheadsystems.pairing.server.exception.PairingException;
import jakarta.ws.rs.core.SecurityContext;

/**
 * Route-level authorization over the principal placed in the {@link SecurityContext} by the
 * host framework's bearer-credential filter.
 */
final class Principals {

  private Principals() {
  }

  static AuthenticatedPrincipal require(SecurityContext securityContext) {
    if (securityContext != null
        && securityContext.getUserPrincipal() instanceof AuthenticatedPrincipal principal) {
      return principal;
    }
    throw PairingException.authentication("No authenticated principal");
  }

  static AdminPrincipal requireAdmin(SecurityContext securityContext) {
    return require(securityContext).match(
        admin -> admin,
        client -> {
          throw PairingException.forbidden("Administrator access required");
        });
  }

  static ClientPrincipal requireClient(SecurityContext securityContext) {
    return require(securityContext).match(
        admin -> {
          throw PairingException.forbidden("Client credential required");
        },
        client -> client);
  }

  static AuthenticatedPrincipal requireArea(SecurityContext securityContext, String areaId) {
    AuthenticatedPrincipal principal = require(securityContext);
    return principal.match(
        admin -> principal,
        client -> {
          if (!client.canAccess(areaId)) {
            throw PairingException.forbidden("Area is not in this credential's scope");
          }
          return principal;
        });
  }
}
