package com.codeheadsystems.pairing.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for pairing sessions.
 * <p>
 * Implementations must be thread-safe. Every state-changing method is a conditional write:
 * the status (and, where given, the time bound) is re-checked atomically with the update, so
 * a background sweep and a live verify or complete call can interleave freely and exactly
 * one of them wins. A SQL implementation expresses each as a single
 * {@code UPDATE ... WHERE status = ? AND ...} and reports whether a row changed.
 */
public interface PairingSessionStore {

  /**
   * Persists a new session.
   *
   * @param session the session
   * @throws IllegalStateException if a session with the same id already exists
   */
  void create(PairingSession session);

  /**
   * Loads a session by id.
   *
   * @param id the id
   * @return the session, or empty if unknown
   */
  Optional<PairingSession> load(String id);

  /**
   * Moves a session from PENDING to VERIFIED if, atomically, it is pending, its PIN equals
   * {@code pin} and {@code now} is before its expiry. A pending session whose PIN has lapsed is
   * moved to EXPIRED instead. A wrong PIN is counted on the session, and the
   * {@code maxFailedAttempts}-th one moves it to EXPIRED.
   *
   * @param id                the session id
   * @param pin               the candidate pin
   * @param deviceName        the device name to record
   * @param deviceType        the device type to record
   * @param now               the now
   * @param maxFailedAttempts wrong PINs after which the session expires
   * @return the verified session, or empty if any condition failed
   */
  Optional<PairingSession> verify(String id, String pin, String deviceName, DeviceType deviceType,
                                  Instant now, int maxFailedAttempts);

  /**
   * Moves a session from VERIFIED to COMPLETED if, atomically, it is verified and was verified
   * after {@code verifiedAfter}.
   *
   * @param id            the session id
   * @param clientId      the client created for the device
   * @param assignedAreas the areas granted
   * @param now           the completion time
   * @param verifiedAfter sessions verified at or before this instant are stale
   * @return the completed session, or empty if any condition failed
   */
  Optional<PairingSession> complete(String id, String clientId, List<String> assignedAreas,
                                    Instant now, Instant verifiedAfter);

  /**
   * Expires every PENDING session whose {@code expiresAt <= now}.
   *
   * @param now the now
   * @return the number of sessions expired
   */
  int expirePending(Instant now);

  /**
   * Expires every VERIFIED session whose {@code verifiedAt <= verifiedAtOrBefore}.
   *
   * @param verifiedAtOrBefore the cutoff
   * @return the number of sessions expired
   */
  int expireVerified(Instant verifiedAtOrBefore);

  /**
   * Deletes COMPLETED and EXPIRED sessions created before {@code createdBefore}.
   *
   * @param createdBefore the cutoff
   * @return the number of sessions removed
   */
  int purgeTerminal(Instant createdBefore);

  /**
   * Deletes a session regardless of its state.
   *
   * @param id the id
   * @return true if a session was removed
   */
  boolean delete(String id);

  /**
   * Number of stored sessions.
   *
   * @return the count
   */
  int count();
}
