package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.auth.IssuedCredential;
import com.codeheadsystems.pairing.server.auth.TokenService;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.notify.EventType;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.DeviceType;
import com.codeheadsystems.pairing.server.store.PairingSession;
import com.codeheadsystems.pairing.server.store.PairingSessionStore;
import com.codeheadsystems.pairing.server.store.SessionStatus;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic driver of the PIN pairing lifecycle.
 * <p>
 * An administrator opens a session and is shown a PIN; the device submits the PIN with its
 * name and type; the administrator approves, which creates the client, mints its credential
 * and closes the session. Every transition is a conditional write in the
 * {@link PairingSessionStore}, so concurrent callers and the expiry sweep cannot both win.
 * <p>
 * <strong>Exception contract:</strong> every failure is a {@link PairingException}.
 * A wrong PIN, an expired PIN and an unknown session all produce the same AUTHENTICATION
 * failure.
 */
public class PairingSessionManager {

  private static final Logger log = LoggerFactory.getLogger(PairingSessionManager.class);
  private static final Pattern PIN_FORMAT = Pattern.compile("\\d{6}");
  private static final int PIN_MIN = 100_000;
  private static final int PIN_RANGE = 900_000;

  private final PairingSessionStore sessionStore;
  private final ClientStore clientStore;
  private final TokenService tokenService;
  private final NotificationRegistry notificationRegistry;
  private final Clock clock;
  private final SecureRandom random;
  private final Duration pinTtl;
  private final Duration verifiedTtl;
  private final int maxPinAttempts;

  /**
   * Instantiates a new Pairing session manager.
   *
   * @param sessionStore         the session store
   * @param clientStore          the client store
   * @param tokenService         the token service
   * @param notificationRegistry the notification registry
   * @param clock                the clock
   * @param random               source of PINs
   * @param pinTtl               how long a PIN is accepted
   * @param verifiedTtl          how long a verified session waits for approval
   * @param maxPinAttempts       wrong PINs a session tolerates before it expires
   */
  public PairingSessionManager(PairingSessionStore sessionStore,
                               ClientStore clientStore,
                               TokenService tokenService,
                               NotificationRegistry notificationRegistry,
                               Clock clock,
                               SecureRandom random,
                               Duration pinTtl,
                               Duration verifiedTtl,
                               int maxPinAttempts) {
    this.sessionStore = sessionStore;
    this.clientStore = clientStore;
    this.tokenService = tokenService;
    this.notificationRegistry = notificationRegistry;
    this.clock = clock;
    this.random = random;
    this.pinTtl = pinTtl;
    this.verifiedTtl = verifiedTtl;
    this.maxPinAttempts = maxPinAttempts;
  }

  /**
   * Opens a pending session with a fresh PIN. The returned session is the only place the
   * PIN is exposed.
   *
   * @return the pending session
   */
  public PairingSession createSession() {
    Instant now = clock.instant();
    PairingSession session = PairingSession.pending(
        "pairing_" + UUID.randomUUID(), generatePin(), now, now.plus(pinTtl));
    sessionStore.create(session);
    log.info("Created pairing session {} expiring at {}", session.id(), session.expiresAt());
    return session;
  }

  /**
   * Verifies a device's PIN. Unauthenticated; called by the device itself.
   *
   * @param sessionId  the session id
   * @param pin        the PIN
   * @param deviceName the device name
   * @param deviceType the device type, wire form
   * @return the verified session
   * @throws PairingException VALIDATION for malformed input, AUTHENTICATION if no pending
   *                          session matches the id and PIN before expiry; the session
   *                          expires once it has seen too many wrong PINs
   */
  public PairingSession verifyPin(String sessionId, String pin, String deviceName, String deviceType) {
    if (pin == null || !PIN_FORMAT.matcher(pin).matches()) {
      throw PairingException.validation("PIN must be exactly 6 digits", "pin");
    }
    String name = Validation.name(deviceName, "deviceName");
    DeviceType type = DeviceType.fromWire(deviceType)
        .orElseThrow(() -> PairingException.validation(
            "deviceType must be one of mobile, tablet, desktop, other", "deviceType"));

    PairingSession verified = sessionStore.verify(sessionId, pin, name, type, clock.instant(), maxPinAttempts)
        .orElseThrow(() -> {
          log.debug("PIN verification failed for session {}", sessionId);
          return PairingException.authentication("Invalid or expired PIN");
        });
    log.info("Pairing session {} verified by {} device '{}'", verified.id(), type.wireName(), name);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("sessionId", verified.id());
    payload.put("deviceName", verified.deviceName());
    payload.put("deviceType", type.wireName());
    notificationRegistry.notifyAdmins(EventType.PAIRING_VERIFIED, payload);
    return verified;
  }

  /**
   * Approves a verified session: creates the client, mints its credential and completes the
   * session. The session is claimed first, so concurrent calls create exactly one client.
   *
   * @param sessionId     the session id
   * @param clientName    the client's display name
   * @param assignedAreas the client's areas, null means none
   * @return the result holding the plaintext credential
   * @throws PairingException VALIDATION, NOT_FOUND, CONFLICT if the session is not verified
   *                          or its approval window has passed, INTERNAL if persistence or
   *                          signing fails
   */
  public PairingResult completePairing(String sessionId, String clientName, List<String> assignedAreas) {
    String name = Validation.name(clientName, "clientName");
    List<String> areas = Validation.areas(assignedAreas, "assignedAreas");

    PairingSession session = sessionStore.load(sessionId)
        .orElseThrow(() -> PairingException.notFound("Pairing session not found"));
    if (session.status() != SessionStatus.VERIFIED) {
      throw PairingException.conflict("Pairing session is " + effectiveStatus(session).wireName()
          + ", it must be verified before it can be completed");
    }

    Instant now = clock.instant();
    String clientId = "client_" + UUID.randomUUID();
    PairingSession completed = sessionStore.complete(sessionId, clientId, areas, now, now.minus(verifiedTtl))
        .orElseThrow(() -> PairingException.conflict("Pairing session is no longer awaiting approval"));

    Client client = new Client(clientId, name, completed.deviceType(), areas, true, now, null);
    try {
      clientStore.createClient(client);
    } catch (RuntimeException e) {
      log.error("Failed to create client for pairing session {}", sessionId, e);
      throw PairingException.internal("Failed to complete pairing", e);
    }
    IssuedCredential credential;
    try {
      credential = tokenService.issue(clientId, areas);
    } catch (RuntimeException e) {
      log.error("Failed to issue credential for pairing session {}, deactivating client {}",
          sessionId, clientId, e);
      deactivateQuietly(clientId);
      throw PairingException.internal("Failed to complete pairing", e);
    }
    log.info("Pairing session {} completed: client {} with {} area(s)", sessionId, clientId, areas.size());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("token", credential.credential());
    payload.put("clientId", clientId);
    payload.put("clientName", name);
    payload.put("assignedAreas", areas);
    payload.put("message", "Pairing completed successfully");
    notificationRegistry.notify(clientId, EventType.PAIRING_COMPLETED, payload);
    return new PairingResult(completed, client, credential);
  }

  /**
   * Loads a session.
   *
   * @param sessionId the session id
   * @return the session
   * @throws PairingException NOT_FOUND if unknown
   */
  public PairingSession getSession(String sessionId) {
    return sessionStore.load(sessionId)
        .orElseThrow(() -> PairingException.notFound("Pairing session not found"));
  }

  /**
   * The status a reader should see now. Lapsed pending sessions and verified sessions past
   * their approval window read as expired before the sweep persists it.
   *
   * @param session the session
   * @return the effective status
   */
  public SessionStatus effectiveStatus(PairingSession session) {
    return session.statusAt(clock.instant(), verifiedTtl);
  }

  /**
   * Deletes a session in any state.
   *
   * @param sessionId the session id
   * @throws PairingException NOT_FOUND if unknown
   */
  public void cancelSession(String sessionId) {
    if (!sessionStore.delete(sessionId)) {
      throw PairingException.notFound("Pairing session not found");
    }
    log.info("Cancelled pairing session {}", sessionId);
  }

  /**
   * Expires pending sessions whose PIN has lapsed.
   *
   * @return the number expired
   */
  public int expirePendingSessions() {
    return sessionStore.expirePending(clock.instant());
  }

  /**
   * Expires verified sessions left unapproved past the approval window.
   *
   * @return the number expired
   */
  public int expireStaleVerifiedSessions() {
    return sessionStore.expireVerified(clock.instant().minus(verifiedTtl));
  }

  /**
   * Deletes completed and expired sessions older than the retention window.
   *
   * @param retention the retention window
   * @return the number deleted
   */
  public int purgeTerminalSessions(Duration retention) {
    return sessionStore.purgeTerminal(clock.instant().minus(retention));
  }

  private void deactivateQuietly(String clientId) {
    try {
      clientStore.deactivateClient(clientId);
    } catch (RuntimeException e) {
      log.error("Failed to deactivate orphaned client {}", clientId, e);
    }
  }

  private String generatePin() {
    return Integer.toString(PIN_MIN + random.nextInt(PIN_RANGE));
  }
}
