package com.codeheadsystems.pairing.server.store;

import java.time.Instant;
import java.util.List;

/**
 * Stored record of an issued client credential. Only the one-way hash of the credential is
 * kept; the plaintext is never persisted.
 *
 * @param id            the token id
 * @param clientId      owning client
 * @param tokenHash     SHA-256 hex digest of the credential, unique across all tokens
 * @param assignedAreas scope used for authorization
 * @param createdAt     issue time
 * @param expiresAt     expiry
 * @param lastUsedAt    time of the last successful check, or null
 * @param revoked       whether the token has been revoked
 * @param revokedAt     revocation time, or null
 * @param revokedReason revocation reason, or null
 */
public record ClientToken(
    String id,
    String clientId,
    String tokenHash,
    List<String> assignedAreas,
    Instant createdAt,
    Instant expiresAt,
    Instant lastUsedAt,
    boolean revoked,
    Instant revokedAt,
    String revokedReason) {

  /**
   * Instantiates a new Client token.
   */
  public ClientToken {
    assignedAreas = assignedAreas == null ? List.of() : List.copyOf(assignedAreas);
  }

  /**
   * Is expired boolean.
   *
   * @param now the now
   * @return true if now is at or past expiresAt
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /**
   * Revoked token.
   *
   * @param at     the at
   * @param reason the reason
   * @return the client token
   */
  public ClientToken withRevoked(Instant at, String reason) {
    return new ClientToken(id, clientId, tokenHash, assignedAreas, createdAt, expiresAt,
        lastUsedAt, true, at, reason);
  }

  /**
   * With last used client token.
   *
   * @param at the at
   * @return the client token
   */
  public ClientToken withLastUsed(Instant at) {
    return new ClientToken(id, clientId, tokenHash, assignedAreas, createdAt, expiresAt,
        at, revoked, revokedAt, revokedReason);
  }

  /**
   * With assigned areas client token.
   *
   * @param areas the areas
   * @return the client token
   */
  public ClientToken withAssignedAreas(List<String> areas) {
    return new ClientToken(id, clientId, tokenHash, areas, createdAt, expiresAt,
        lastUsedAt, revoked, revokedAt, revokedReason);
  }
}
