package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.auth.IssuedCredential;
import com.codeheadsystems.pairing.server.auth.TokenService;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.notify.EventType;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.ClientToken;
import com.codeheadsystems.pairing.server.store.TokenStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrator operations on client token records, outside the pairing flow.
 */
public class ClientTokenManager {

  /**
   * Revocation reason used when the administrator gives none.
   */
  public static final String DEFAULT_REVOKE_REASON = "Revoked by administrator";

  /**
   * Window in which a token counts as recently used.
   */
  static final Duration RECENT_USE = Duration.ofHours(24);

  private static final Logger log = LoggerFactory.getLogger(ClientTokenManager.class);

  private final ClientStore clientStore;
  private final TokenService tokenService;
  private final NotificationRegistry notificationRegistry;
  private final Clock clock;

  /**
   * Instantiates a new Client token manager.
   *
   * @param clientStore          the client store
   * @param tokenService         the token service
   * @param notificationRegistry the notification registry
   * @param clock                the clock
   */
  public ClientTokenManager(ClientStore clientStore, TokenService tokenService,
                            NotificationRegistry notificationRegistry, Clock clock) {
    this.clientStore = clientStore;
    this.tokenService = tokenService;
    this.notificationRegistry = notificationRegistry;
    this.clock = clock;
  }

  /**
   * Issues a new credential for an existing, active client.
   *
   * @param clientId      the client id
   * @param assignedAreas the scope, or null to use the client's current areas
   * @return the credential; its plaintext must be returned to the caller once
   */
  public IssuedCredential issueToken(String clientId, List<String> assignedAreas) {
    if (clientId == null || clientId.isBlank()) {
      throw PairingException.validation("clientId is required", "clientId");
    }
    Client client = clientStore.findClient(clientId)
        .filter(Client::active)
        .orElseThrow(() -> PairingException.notFound("Client not found"));
    List<String> areas = assignedAreas == null
        ? client.assignedAreas()
        : Validation.areas(assignedAreas, "assignedAreas");
    try {
      return tokenService.issue(clientId, areas);
    } catch (RuntimeException e) {
      log.error("Failed to issue token for client {}", clientId, e);
      throw PairingException.internal("Failed to issue token", e);
    }
  }

  /**
   * Lists token records, newest first.
   *
   * @param clientId restricts to one client when non-null
   * @return the tokens
   */
  public List<ClientToken> listTokens(String clientId) {
    return clientStore.listTokens(clientId);
  }

  /**
   * Gets a token record.
   *
   * @param tokenId the token id
   * @return the token
   */
  public ClientToken getToken(String tokenId) {
    return clientStore.findTokenById(tokenId)
        .orElseThrow(() -> PairingException.notFound("Token not found"));
  }

  /**
   * Revokes a token and disconnects its client.
   *
   * @param tokenId the token id
   * @param reason  the reason, or null for the default
   * @return the revoked token
   * @throws PairingException NOT_FOUND, or CONFLICT if already revoked
   */
  public ClientToken revokeToken(String tokenId, String reason) {
    ClientToken token = getToken(tokenId);
    if (token.revoked()) {
      throw PairingException.conflict("Token is already revoked");
    }
    String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_REVOKE_REASON : reason.trim();
    if (!tokenService.revoke(token.tokenHash(), effectiveReason)) {
      throw PairingException.conflict("Token is already revoked");
    }
    notificationRegistry.disconnectClient(token.clientId(), effectiveReason);
    return getToken(tokenId);
  }

  /**
   * Replaces one token's scope. The client record is not changed.
   *
   * @param tokenId       the token id
   * @param assignedAreas the new scope
   * @return the updated token
   * @throws PairingException VALIDATION, NOT_FOUND, or CONFLICT if the token is revoked
   */
  public ClientToken updateTokenAreas(String tokenId, List<String> assignedAreas) {
    if (assignedAreas == null) {
      throw PairingException.validation("assignedAreas is required", "assignedAreas");
    }
    List<String> areas = Validation.areas(assignedAreas, "assignedAreas");
    ClientToken token = getToken(tokenId);
    if (token.revoked()) {
      throw PairingException.conflict("Cannot update a revoked token");
    }
    ClientToken updated = clientStore.updateTokenAreas(tokenId, areas)
        .orElseThrow(() -> PairingException.conflict("Cannot update a revoked token"));
    log.info("Token {} rescoped to {}", tokenId, areas);
    notificationRegistry.notify(updated.clientId(), EventType.AREA_UPDATED,
        Map.of("tokenId", tokenId, "assignedAreas", areas));
    return updated;
  }

  /**
   * Deletes expired token records.
   *
   * @return the number deleted
   */
  public int cleanupExpired() {
    return tokenService.sweepExpired();
  }

  /**
   * Token statistics; recently used means within the last 24 hours.
   *
   * @return the stats
   */
  public TokenStats stats() {
    Instant now = clock.instant();
    return clientStore.tokenStats(now, now.minus(RECENT_USE));
  }
}
