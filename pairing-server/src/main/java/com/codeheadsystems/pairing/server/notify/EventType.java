package com.codeheadsystems.pairing.server.notify;

import java.util.Locale;

/**
 * Events pushed over realtime connections. Every event payload carries an ISO-8601
 * {@code timestamp}.
 */
public enum EventType {
  /**
   * Sent once when a connection is registered.
   */
  CONNECTED,
  /**
   * Sent to administrators when a device verifies its PIN.
   */
  PAIRING_VERIFIED,
  /**
   * Sent to a newly paired client; carries the one-time plaintext credential.
   */
  PAIRING_COMPLETED,
  AREA_ADDED,
  AREA_REMOVED,
  AREA_UPDATED,
  AREA_ENABLED,
  AREA_DISABLED,
  /**
   * Terminal event; the connection is closed shortly after.
   */
  TOKEN_REVOKED;

  /**
   * Lowercase wire form, used as the event name.
   *
   * @return the wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
