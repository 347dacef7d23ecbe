package com.codeheadsystems.pairing.server.store;

import java.util.Locale;

/**
 * Pairing session states. Transitions only move forward:
 * <pre>
 *   PENDING  -- pin verified before expiry --&gt; VERIFIED
 *   PENDING  -- expiry swept              --&gt; EXPIRED
 *   VERIFIED -- administrator completes    --&gt; COMPLETED
 *   VERIFIED -- approval window swept      --&gt; EXPIRED
 * </pre>
 */
public enum SessionStatus {
  PENDING,
  VERIFIED,
  COMPLETED,
  EXPIRED;

  /**
   * Whether no further transition is possible.
   *
   * @return true for COMPLETED and EXPIRED
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == EXPIRED;
  }

  /**
   * Lowercase wire form.
   *
   * @return the wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
