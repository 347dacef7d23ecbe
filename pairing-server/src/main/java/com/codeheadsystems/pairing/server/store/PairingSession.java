package com.codeheadsystems.pairing.server.store;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of a pairing session. State changes produce a new instance through the
 * {@code with*} methods, which refuse any transition that is not allowed from the current
 * status.
 *
 * @param id                    opaque unique id
 * @param pin                   6-digit PIN
 * @param status                current status
 * @param deviceName            device name, set on verification
 * @param deviceType            device type, set on verification
 * @param assignedAreasSnapshot areas granted at completion, empty before
 * @param clientId              id of the client created at completion, or null
 * @param createdAt             creation time
 * @param expiresAt             PIN expiry
 * @param verifiedAt            verification time, or null
 * @param completedAt           completion time, or null
 * @param failedPinAttempts     wrong PINs submitted while pending
 */
public record PairingSession(
    String id,
    String pin,
    SessionStatus status,
    String deviceName,
    DeviceType deviceType,
    List<String> assignedAreasSnapshot,
    String clientId,
    Instant createdAt,
    Instant expiresAt,
    Instant verifiedAt,
    Instant completedAt,
    int failedPinAttempts) {

  private static final Pattern PIN_PATTERN = Pattern.compile("\\d{6}");

  /**
   * Validates the invariants every stored session satisfies.
   */
  public PairingSession {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (pin == null || !PIN_PATTERN.matcher(pin).matches()) {
      throw new IllegalArgumentException("PIN must be exactly 6 digits");
    }
    if (!expiresAt.isAfter(createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    assignedAreasSnapshot = assignedAreasSnapshot == null ? List.of() : List.copyOf(assignedAreasSnapshot);
  }

  /**
   * A freshly created pending session.
   *
   * @param id        the id
   * @param pin       the pin
   * @param createdAt the created at
   * @param expiresAt the expires at
   * @return the pairing session
   */
  public static PairingSession pending(String id, String pin, Instant createdAt, Instant expiresAt) {
    return new PairingSession(id, pin, SessionStatus.PENDING, null, null, List.of(), null,
        createdAt, expiresAt, null, null, 0);
  }

  /**
   * Whether the PIN is still accepted at the given instant.
   *
   * @param now the now
   * @return true if now is strictly before expiresAt
   */
  public boolean isPinLive(Instant now) {
    return now.isBefore(expiresAt);
  }

  /**
   * Whether a verified session is still inside its approval window at the given instant.
   *
   * @param now         the now
   * @param verifiedTtl the approval window
   * @return true if verified and now is strictly before verifiedAt plus the window
   */
  public boolean isAwaitingApproval(Instant now, Duration verifiedTtl) {
    return status == SessionStatus.VERIFIED && now.isBefore(verifiedAt.plus(verifiedTtl));
  }

  /**
   * The status a reader should see at {@code now}. A pending session whose PIN has lapsed,
   * or a verified session whose approval window has passed, reads as expired even before the
   * sweep persists the transition.
   *
   * @param now         the now
   * @param verifiedTtl the approval window
   * @return the effective status
   */
  public SessionStatus statusAt(Instant now, Duration verifiedTtl) {
    if (status == SessionStatus.PENDING && !isPinLive(now)) {
      return SessionStatus.EXPIRED;
    }
    if (status == SessionStatus.VERIFIED && !isAwaitingApproval(now, verifiedTtl)) {
      return SessionStatus.EXPIRED;
    }
    return status;
  }

  /**
   * PENDING to VERIFIED.
   *
   * @param name       the device name
   * @param type       the device type
   * @param verifiedAt the verified at
   * @return the verified session
   */
  public PairingSession withVerified(String name, DeviceType type, Instant verifiedAt) {
    requireStatus(SessionStatus.PENDING);
    return new PairingSession(id, pin, SessionStatus.VERIFIED, name, type, List.of(), null,
        createdAt, expiresAt, verifiedAt, null, failedPinAttempts);
  }

  /**
   * VERIFIED to COMPLETED.
   *
   * @param newClientId the client created for this device
   * @param areas       the granted areas
   * @param completed   the completion time
   * @return the completed session
   */
  public PairingSession withCompleted(String newClientId, List<String> areas, Instant completed) {
    requireStatus(SessionStatus.VERIFIED);
    return new PairingSession(id, pin, SessionStatus.COMPLETED, deviceName, deviceType, areas,
        newClientId, createdAt, expiresAt, verifiedAt, completed, failedPinAttempts);
  }

  /**
   * PENDING or VERIFIED to EXPIRED.
   *
   * @return the expired session
   */
  public PairingSession withExpired() {
    if (status.isTerminal()) {
      throw new IllegalStateException("Session " + id + " is already " + status.wireName());
    }
    return new PairingSession(id, pin, SessionStatus.EXPIRED, deviceName, deviceType,
        assignedAreasSnapshot, clientId, createdAt, expiresAt, verifiedAt, completedAt,
        failedPinAttempts);
  }

  /**
   * Records one wrong PIN on a pending session.
   *
   * @return the session with the attempt counted
   */
  public PairingSession withFailedPinAttempt() {
    requireStatus(SessionStatus.PENDING);
    return new PairingSession(id, pin, status, deviceName, deviceType, assignedAreasSnapshot,
        clientId, createdAt, expiresAt, verifiedAt, completedAt, failedPinAttempts + 1);
  }

  private void requireStatus(SessionStatus required) {
    if (status != required) {
      throw new IllegalStateException("Session " + id + " is " + status.wireName()
          + ", expected " + required.wireName());
    }
  }

  @Override
  public String toString() {
    return "PairingSession[id=" + id + ", status=" + status + ", pin=******]";
  }
}
