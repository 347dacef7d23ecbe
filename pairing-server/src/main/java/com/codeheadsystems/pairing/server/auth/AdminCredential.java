package com.codeheadsystems.pairing.server.auth;

import java.time.Instant;

/**
 * A short-lived administrator credential.
 *
 * @param credential the signed credential
 * @param username   the administrator
 * @param expiresAt  the expiry
 */
public record AdminCredential(String credential, String username, Instant expiresAt) {

  @Override
  public String toString() {
    return "AdminCredential[username=" + username + ", expiresAt=" + expiresAt + "]";
  }
}
