package com.codeheadsystems.pairing.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.InvalidClaimException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.ClientToken;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, hashes, verifies and revokes bearer credentials.
 * <p>
 * Both credential kinds are JWTs signed with HMAC-SHA256 under one process-wide secret and
 * carry the same issuer and audience; the {@code role} claim separates them. Client
 * credentials are long-lived and backed by a {@link ClientToken} row keyed by the SHA-256 of
 * the credential, which is what makes them revocable. Admin credentials are short-lived and
 * stateless.
 * <p>
 * Verification failures are logged at debug with their specific cause and reported to
 * callers as an empty result.
 */
public class TokenService {

  /**
   * Role claim value of client credentials.
   */
  public static final String ROLE_CLIENT = "client";
  /**
   * Role claim value of admin credentials.
   */
  public static final String ROLE_ADMIN = "admin";

  static final String CLAIM_ROLE = "role";
  static final String CLAIM_TYPE = "type";
  static final String CLAIM_CLIENT_ID = "clientId";
  static final String CLAIM_ASSIGNED_AREAS = "assignedAreas";
  static final String CLAIM_USERNAME = "username";

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);
  private static final HexFormat HEX = HexFormat.of();

  private final Algorithm algorithm;
  private final JWTVerifier clientVerifier;
  private final JWTVerifier adminVerifier;
  private final String issuer;
  private final String audience;
  private final Duration clientTtl;
  private final Duration adminTtl;
  private final ClientStore clientStore;
  private final Clock clock;

  /**
   * Creates a new TokenService.
   *
   * @param secret      HMAC-SHA256 signing secret
   * @param issuer      issuer claim
   * @param audience    audience claim
   * @param clientTtl   client credential lifetime
   * @param adminTtl    admin credential lifetime
   * @param clientStore backing store for token records
   * @param clock       time source for issue and verification
   */
  public TokenService(byte[] secret, String issuer, String audience, Duration clientTtl,
                      Duration adminTtl, ClientStore clientStore, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.issuer = issuer;
    this.audience = audience;
    this.clientTtl = clientTtl;
    this.adminTtl = adminTtl;
    this.clientStore = clientStore;
    this.clock = clock;
    this.clientVerifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .withAudience(audience)
        .withClaim(CLAIM_ROLE, ROLE_CLIENT))
        .build(clock);
    this.adminVerifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .withAudience(audience)
        .withClaim(CLAIM_ROLE, ROLE_ADMIN))
        .build(clock);
  }

  /**
   * Mints a client credential scoped to {@code assignedAreas} and persists its token record.
   *
   * @param clientId      the client id
   * @param assignedAreas the scope
   * @return the plaintext credential with its stored record
   */
  public IssuedCredential issue(String clientId, List<String> assignedAreas) {
    String tokenId = "token_" + UUID.randomUUID();
    // JWT timestamps carry whole seconds; keep the stored record identical to the claims.
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(clientTtl);

    String credential = JWT.create()
        .withIssuer(issuer)
        .withAudience(audience)
        .withJWTId(tokenId)
        .withSubject(clientId)
        .withClaim(CLAIM_CLIENT_ID, clientId)
        .withClaim(CLAIM_ROLE, ROLE_CLIENT)
        .withClaim(CLAIM_TYPE, ROLE_CLIENT)
        .withClaim(CLAIM_ASSIGNED_AREAS, List.copyOf(assignedAreas))
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    String tokenHash = hash(credential);
    ClientToken token = new ClientToken(tokenId, clientId, tokenHash, assignedAreas, now,
        expiresAt, null, false, null, null);
    clientStore.saveToken(token);
    log.info("Issued client token id={} client={} hash={}", tokenId, clientId, abbreviate(tokenHash));
    return new IssuedCredential(credential, token);
  }

  /**
   * SHA-256 of the credential, hex encoded. Used as the storage and lookup key.
   *
   * @param credential the plaintext credential
   * @return the lowercase hex digest
   */
  public String hash(String credential) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HEX.formatHex(digest.digest(credential.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Checks signature, expiry, issuer, audience and role of a client credential. Does not
   * consult the store.
   *
   * @param credential the plaintext credential
   * @return the embedded claims, or empty if the credential is not a valid client credential
   */
  public Optional<ClientClaims> verify(String credential) {
    return verifyWith(clientVerifier, credential, ROLE_CLIENT).flatMap(decoded -> {
      String clientId = decoded.getClaim(CLAIM_CLIENT_ID).asString();
      if (clientId == null || clientId.isBlank()) {
        log.debug("Client credential carries no clientId");
        return Optional.empty();
      }
      List<String> areas = decoded.getClaim(CLAIM_ASSIGNED_AREAS).asList(String.class);
      return Optional.of(new ClientClaims(clientId, areas));
    });
  }

  /**
   * Mints a stateless administrator credential.
   *
   * @param username the administrator
   * @return the credential
   */
  public AdminCredential issueAdmin(String username) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(adminTtl);
    String credential = JWT.create()
        .withIssuer(issuer)
        .withAudience(audience)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(username)
        .withClaim(CLAIM_USERNAME, username)
        .withClaim(CLAIM_ROLE, ROLE_ADMIN)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.info("Issued admin credential for {}", username);
    return new AdminCredential(credential, username, expiresAt);
  }

  /**
   * Verifies an administrator credential.
   *
   * @param credential the credential
   * @return the administrator's user name, or empty if invalid
   */
  public Optional<String> verifyAdmin(String credential) {
    return verifyWith(adminVerifier, credential, ROLE_ADMIN).flatMap(decoded -> {
      String username = decoded.getClaim(CLAIM_USERNAME).asString();
      if (username == null || username.isBlank()) {
        log.debug("Admin credential carries no username");
        return Optional.empty();
      }
      return Optional.of(username);
    });
  }

  /**
   * Revokes the token record with the given hash.
   *
   * @param tokenHash the token hash
   * @param reason    the reason, may be null
   * @return true on the first successful revocation, false if unknown or already revoked
   */
  public boolean revoke(String tokenHash, String reason) {
    boolean revoked = clientStore.revokeToken(tokenHash, reason, clock.instant());
    if (revoked) {
      log.info("Revoked token hash={} reason={}", abbreviate(tokenHash), reason);
    } else {
      log.debug("Token hash={} not revoked (unknown or already revoked)", abbreviate(tokenHash));
    }
    return revoked;
  }

  /**
   * Deletes token records past their expiry.
   *
   * @return the number of records deleted
   */
  public int sweepExpired() {
    int deleted = clientStore.deleteExpiredTokens(clock.instant());
    if (deleted > 0) {
      log.info("Deleted {} expired token record(s)", deleted);
    }
    return deleted;
  }

  /**
   * First 8 hex characters of a token hash, for logs.
   *
   * @param tokenHash the token hash
   * @return the abbreviated hash
   */
  public static String abbreviate(String tokenHash) {
    if (tokenHash == null) {
      return "null";
    }
    return tokenHash.length() <= 8 ? tokenHash : tokenHash.substring(0, 8);
  }

  private Optional<DecodedJWT> verifyWith(JWTVerifier verifier, String credential, String role) {
    if (credential == null || credential.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(verifier.verify(credential));
    } catch (TokenExpiredException e) {
      log.debug("{} credential expired: {}", role, e.getMessage());
    } catch (SignatureVerificationException e) {
      log.debug("{} credential has a bad signature", role);
    } catch (InvalidClaimException e) {
      log.debug("{} credential has a wrong claim: {}", role, e.getMessage());
    } catch (JWTDecodeException e) {
      log.debug("{} credential is malformed: {}", role, e.getMessage());
    } catch (JWTVerificationException e) {
      log.debug("{} credential verification failed: {}", role, e.getMessage());
    } catch (RuntimeException e) {
      log.debug("{} credential could not be parsed: {}", role, e.toString());
    }
    return Optional.empty();
  }
}
