package com.codeheadsystems.pairing.server.exception;

/**
 * Classification of a {@link PairingException}. The request layer maps each kind to a
 * single HTTP status.
 */
public enum ErrorKind {
  /**
   * Malformed input: PIN, name, device type or area list. HTTP 400.
   */
  VALIDATION,
  /**
   * Unknown session, client or token id. HTTP 404.
   */
  NOT_FOUND,
  /**
   * Missing, invalid, expired or revoked credential, or a PIN that does not match a live
   * session. HTTP 401, always with the same message.
   */
  AUTHENTICATION,
  /**
   * Authenticated, but as the wrong kind of principal. HTTP 403.
   */
  FORBIDDEN,
  /**
   * The target is not in the state the operation requires. HTTP 409.
   */
  CONFLICT,
  /**
   * Unexpected persistence or signing failure. HTTP 500, generic message.
   */
  INTERNAL
}
