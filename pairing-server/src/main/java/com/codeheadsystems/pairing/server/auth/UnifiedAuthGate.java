package com.codeheadsystems.pairing.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.ClientToken;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single authentication entry point for HTTP requests and realtime connections.
 * <p>
 * Resolution happens in two explicit steps:
 * <ol>
 *   <li>The {@code role} claim is read from the <em>unverified</em> credential. This only
 *       picks the verification path and establishes no trust.</li>
 *   <li>The credential is verified cryptographically along that path. Admin credentials are
 *       stateless. Client credentials must additionally match a stored token row that is not
 *       revoked and not expired, whose client is still active; the row's
 *       {@code lastUsedAt} is updated on success.</li>
 * </ol>
 * Every failure surfaces as the same {@link PairingException} of kind AUTHENTICATION; the
 * specific cause is only logged.
 */
public class UnifiedAuthGate {

  private static final Logger log = LoggerFactory.getLogger(UnifiedAuthGate.class);
  private static final String FAILURE = "Authentication failed";

  private final TokenService tokenService;
  private final ClientStore clientStore;
  private final Clock clock;

  /**
   * Instantiates a new Unified auth gate.
   *
   * @param tokenService the token service
   * @param clientStore  the client store
   * @param clock        the clock
   */
  public UnifiedAuthGate(TokenService tokenService, ClientStore clientStore, Clock clock) {
    this.tokenService = tokenService;
    this.clientStore = clientStore;
    this.clock = clock;
  }

  /**
   * Resolves a bearer credential to a principal.
   *
   * @param credential the credential without any {@code Bearer} prefix, may be null
   * @return the principal
   * @throws PairingException of kind AUTHENTICATION on any failure
   */
  public AuthenticatedPrincipal authenticate(String credential) {
    if (credential == null || credential.isBlank()) {
      throw reject("no credential");
    }
    String role = peekRole(credential).orElseThrow(() -> reject("undecodable credential"));
    if (TokenService.ROLE_ADMIN.equals(role)) {
      return tokenService.verifyAdmin(credential)
          .map(AdminPrincipal::new)
          .orElseThrow(() -> reject("admin credential failed verification"));
    }
    if (TokenService.ROLE_CLIENT.equals(role)) {
      try {
        return authenticateClient(credential);
      } catch (PairingException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn("Unexpected failure authenticating client credential: {}", e.toString());
        throw reject("client credential check failed");
      }
    }
    throw reject("unknown role");
  }

  private AuthenticatedPrincipal authenticateClient(String credential) {
    ClientClaims claims = tokenService.verify(credential)
        .orElseThrow(() -> reject("client credential failed verification"));
    String tokenHash = tokenService.hash(credential);
    ClientToken token = clientStore.findTokenByHash(tokenHash)
        .orElseThrow(() -> reject("no token record for hash " + TokenService.abbreviate(tokenHash)));
    Instant now = clock.instant();
    if (token.revoked()) {
      log.warn("Rejected revoked token id={} client={}", token.id(), token.clientId());
      throw reject("token revoked");
    }
    if (token.isExpired(now)) {
      throw reject("token record expired");
    }
    if (!token.clientId().equals(claims.clientId())) {
      throw reject("token record belongs to a different client");
    }
    Client client = clientStore.findClient(token.clientId())
        .orElseThrow(() -> reject("client record missing"));
    if (!client.active()) {
      throw reject("client inactive");
    }
    clientStore.recordUsage(token.id(), client.id(), now);
    return new ClientPrincipal(client.id(), token.assignedAreas(), token.id());
  }

  private static Optional<String> peekRole(String credential) {
    try {
      return Optional.ofNullable(JWT.decode(credential).getClaim(TokenService.CLAIM_ROLE).asString());
    } catch (JWTDecodeException e) {
      return Optional.empty();
    } catch (RuntimeException e) {
      // java-jwt decodes a literal null header or payload without complaint, then NPEs on it.
      log.debug("Credential structure unreadable: {}", e.toString());
      return Optional.empty();
    }
  }

  private static PairingException reject(String cause) {
    log.debug("Authentication rejected: {}", cause);
    return PairingException.authentication(FAILURE);
  }
}
