package com.codeheadsystems.pairing.server.auth;

import java.util.List;

/**
 * Claims carried by a cryptographically valid client credential.
 *
 * @param clientId      the client id
 * @param assignedAreas the scope embedded at issue time
 */
public record ClientClaims(String clientId, List<String> assignedAreas) {

  /**
   * Instantiates a new Client claims.
   */
  public ClientClaims {
    assignedAreas = assignedAreas == null ? List.of() : List.copyOf(assignedAreas);
  }
}
