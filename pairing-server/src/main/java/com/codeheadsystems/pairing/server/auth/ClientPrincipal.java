package com.codeheadsystems.pairing.server.auth;

import java.util.List;
import java.util.function.Function;

/**
 * A paired client authenticated by a stored, non-revoked client credential.
 *
 * @param clientId      the client id
 * @param assignedAreas the scope of the stored token record at the time of the check
 * @param tokenId       the token record that authenticated this request
 */
public record ClientPrincipal(String clientId, List<String> assignedAreas, String tokenId)
    implements AuthenticatedPrincipal {

  /**
   * Instantiates a new Client principal.
   */
  public ClientPrincipal {
    assignedAreas = assignedAreas == null ? List.of() : List.copyOf(assignedAreas);
  }

  @Override
  public String getName() {
    return clientId;
  }

  @Override
  public <R> R match(Function<AdminPrincipal, R> onAdmin, Function<ClientPrincipal, R> onClient) {
    return onClient.apply(this);
  }

  /**
   * Whether the principal may act on the given area.
   *
   * @param areaId the area id
   * @return true if the area is in scope
   */
  public boolean canAccess(String areaId) {
    return assignedAreas.contains(areaId);
  }
}
